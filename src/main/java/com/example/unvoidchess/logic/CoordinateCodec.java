package com.example.unvoidchess.logic;

import com.example.unvoidchess.exception.CoordinateFormatException;
import com.example.unvoidchess.exception.CoordinateRangeException;
import com.example.unvoidchess.model.domain.Point;

import java.util.regex.Pattern;

/**
 * Converts between square labels such as {@code C3} and zero-based grid
 * indices. The letter selects the column ('A' is column 0, case-insensitive),
 * the number selects the row (1 is row 0).
 */
public final class CoordinateCodec {

    private static final Pattern ROW_DIGITS = Pattern.compile("\\+?\\d+");

    private CoordinateCodec() {
    }

    /**
     * @param label  square label, surrounding whitespace ignored
     * @param height board height
     * @param width  board width
     * @return zero-based (row, column)
     * @throws CoordinateFormatException if the label is too short or the row is not a positive integer
     * @throws CoordinateRangeException  if the square lies outside the board
     */
    public static Point parse(String label, int height, int width) {
        String s = label == null ? "" : label.trim();
        if (s.length() < 2) {
            throw new CoordinateFormatException(label, "Invalid coordinate format: " + label);
        }

        char colChar = Character.toUpperCase(s.charAt(0));
        String rowStr = s.substring(1);

        int rowNum;
        if (!ROW_DIGITS.matcher(rowStr).matches()) {
            throw new CoordinateFormatException(label, "Invalid row number in coordinate: " + label);
        }
        try {
            rowNum = Integer.parseInt(rowStr);
        } catch (NumberFormatException e) {
            // digits only at this point, so the number is just too large
            throw new CoordinateRangeException(label,
                    "Row number " + rowStr + " out of bounds (1-" + height + ").");
        }

        if (rowNum == 0 || rowNum > height) {
            throw new CoordinateRangeException(label,
                    "Row number " + rowNum + " out of bounds (1-" + height + ").");
        }
        int colIdx = colChar - 'A';
        if (colIdx < 0 || colIdx >= width) {
            throw new CoordinateRangeException(label,
                    "Column " + colChar + " out of bounds (A-" + columnLetter(width - 1) + ").");
        }
        return new Point(rowNum - 1, colIdx);
    }

    public static String format(int r, int c) {
        return columnLetter(c) + String.valueOf(r + 1);
    }

    public static String format(Point p) {
        return format(p.r(), p.c());
    }

    public static char columnLetter(int c) {
        return (char) ('A' + c);
    }
}
