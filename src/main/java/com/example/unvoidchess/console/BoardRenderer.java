package com.example.unvoidchess.console;

import com.example.unvoidchess.logic.CoordinateCodec;
import com.example.unvoidchess.model.domain.MoveDetail;
import com.example.unvoidchess.model.domain.Piece;
import com.example.unvoidchess.model.domain.Point;
import com.example.unvoidchess.model.dto.GameStateDTO;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Draws the board as text, top row first. The selected square is bracketed and
 * empty squares the selection can reach show '.' (move) or '•' (capture).
 */
@Component
public class BoardRenderer {

    static final char MOVE_MARK = '.';
    static final char CAPTURE_MARK = '•';

    public String render(GameStateDTO state) {
        StringBuilder sb = new StringBuilder();
        int width = state.getWidth();
        int height = state.getHeight();

        sb.append('\n').append("   ");
        for (int c = 0; c < width; c++) {
            sb.append(' ').append(CoordinateCodec.columnLetter(c)).append(' ');
        }
        sb.append('\n');
        appendBorder(sb, width);

        for (int r = height - 1; r >= 0; r--) {
            sb.append(String.format("%2d|", r + 1));
            for (int c = 0; c < width; c++) {
                String content = cellContent(state, r, c);
                if (isSelected(state.getSelectedSquare(), r, c)) {
                    sb.append('[').append(content).append(']');
                } else {
                    sb.append(' ').append(content).append(' ');
                }
            }
            sb.append("|\n");
        }
        appendBorder(sb, width);
        return sb.toString();
    }

    private void appendBorder(StringBuilder sb, int width) {
        sb.append("  +-").append("--".repeat(width)).append("+\n");
    }

    private String cellContent(GameStateDTO state, int r, int c) {
        Piece piece = state.getBoard()[r][c];
        if (piece != null) {
            return piece.symbol();
        }
        return String.valueOf(moveMark(state.getAvailableMoves(), r, c));
    }

    private char moveMark(List<MoveDetail> moves, int r, int c) {
        if (moves == null) {
            return ' ';
        }
        for (MoveDetail m : moves) {
            if (m.targets(r, c)) {
                return m.capture() ? CAPTURE_MARK : MOVE_MARK;
            }
        }
        return ' ';
    }

    private boolean isSelected(Point selected, int r, int c) {
        return selected != null && selected.r() == r && selected.c() == c;
    }
}
