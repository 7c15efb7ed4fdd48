package com.example.unvoidchess.console;

import com.example.unvoidchess.exception.GameRuleException;
import com.example.unvoidchess.exception.InvalidCoordinateException;
import com.example.unvoidchess.logic.CoordinateCodec;
import com.example.unvoidchess.model.domain.Game;
import com.example.unvoidchess.model.domain.MoveDetail;
import com.example.unvoidchess.model.domain.MoveRecord;
import com.example.unvoidchess.model.domain.Piece;
import com.example.unvoidchess.model.domain.Point;
import com.example.unvoidchess.service.GameService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Text front end: asks for the board size, then reads one command per line
 * until "exit" or end of input.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chess.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsoleGameRunner implements CommandLineRunner {

    private final GameService gameService;
    private final BoardRenderer boardRenderer;

    @Value("${chess.board.min-dimension:6}")
    private int minDimension = 6;

    @Value("${chess.board.max-dimension:12}")
    private int maxDimension = 12;

    public ConsoleGameRunner(GameService gameService, BoardRenderer boardRenderer) {
        this.gameService = gameService;
        this.boardRenderer = boardRenderer;
    }

    @Override
    public void run(String... args) {
        play(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
    }

    public void play(BufferedReader in, PrintStream out) {
        try {
            out.println("Welcome to Unvoid Chess!");
            Integer width = readDimension(in, out, "Enter board width (" + minDimension + "-" + maxDimension + "): ");
            if (width == null) {
                return;
            }
            Integer height = readDimension(in, out, "Enter board height (" + minDimension + "-" + maxDimension + "): ");
            if (height == null) {
                return;
            }
            out.println("Starting match on the (" + width + " x " + height + ") board...");
            gameService.startMatch(width, height);

            boolean running = true;
            while (running) {
                out.print(boardRenderer.render(gameService.snapshot()));
                out.println();
                printTurnInfo(out);
                if (!gameService.getGame().isGameOver()) {
                    out.print("Type a command (type \"help\" for options):\n> ");
                }
                out.flush();

                String line = in.readLine();
                if (line == null) {
                    log.debug("Input closed, leaving the game loop");
                    break;
                }
                running = handleCommand(line, out);
                out.println();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read console input", e);
        }
    }

    private Integer readDimension(BufferedReader in, PrintStream out, String prompt) throws IOException {
        while (true) {
            out.print(prompt);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return null;
            }
            try {
                int value = Integer.parseInt(line.trim());
                if (value >= minDimension && value <= maxDimension) {
                    return value;
                }
            } catch (NumberFormatException e) {
                log.debug("Rejected board dimension '{}'", line);
            }
            out.println("Invalid input. Please enter a number between " + minDimension + " and " + maxDimension + ".");
        }
    }

    private void printTurnInfo(PrintStream out) {
        Game game = gameService.getGame();
        if (game.isGameOver()) {
            out.println(game.getWinner().getDisplayName() + " wins! 🎉");
            out.println("Type \"restart\" to play again or \"exit\" to leave.");
        } else {
            out.println("Turn: " + game.getCurrentPlayer().getDisplayName());
        }
    }

    /**
     * Executes one command line.
     *
     * @return false once the player asked to leave
     */
    boolean handleCommand(String line, PrintStream out) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            return true;
        }
        String command = parts[0].toLowerCase(Locale.ROOT);

        if (gameService.getGame().isGameOver() && !command.equals("restart") && !command.equals("exit")) {
            out.println("Game is over. Type \"restart\" to play again or \"exit\" to leave.");
            return true;
        }

        switch (command) {
            case "help" -> printHelp(out);
            case "exit" -> {
                out.println("Exiting Unvoid Chess. Goodbye!");
                return false;
            }
            case "restart" -> {
                out.println("Restarting match...");
                gameService.restart();
            }
            case "select" -> handleSelect(parts, out);
            case "move" -> handleMove(parts, out);
            default -> {
                out.println("Unknown command: " + command);
                out.println("Type \"help\" to see a list of valid commands.");
            }
        }
        return true;
    }

    private void printHelp(PrintStream out) {
        out.println("Available commands:");
        out.println("  move <from> <to>    Move a piece (e.g. move B1 C3)");
        out.println("  select <square>     Highlight piece (e.g. select B1)");
        out.println("  restart             Restart the match");
        out.println("  exit                Exit the game");
        out.println("  help                Show this list");
    }

    private void handleSelect(String[] parts, PrintStream out) {
        if (parts.length != 2) {
            out.println("Invalid input: The 'select' command takes only one coordinate.");
            out.println("Usage: select <square>");
            out.println("Example: select C1");
            return;
        }
        String label = parts[1];
        Point square;
        try {
            square = gameService.parseSquare(label);
        } catch (InvalidCoordinateException e) {
            Game game = gameService.getGame();
            out.println("Invalid input: " + label.toUpperCase(Locale.ROOT) + " is not a valid square on the board.");
            out.println("Please enter coordinates from A1 to "
                    + CoordinateCodec.format(game.getBoard().getHeight() - 1, game.getBoard().getWidth() - 1) + ".");
            return;
        }

        try {
            List<MoveDetail> moves = gameService.select(square);
            Piece piece = gameService.getGame().getBoard().getPiece(square.r(), square.c()).orElseThrow();
            String where = CoordinateCodec.format(square);
            if (moves.isEmpty()) {
                out.println("Selected: " + piece + " at " + where + ". No available moves.");
            } else {
                out.println("Selected: " + piece + " at " + where + ". Available moves: " + moves.stream()
                        .map(m -> CoordinateCodec.format(m.toR(), m.toC()))
                        .collect(Collectors.joining(", ")));
            }
        } catch (GameRuleException e) {
            out.println(e.getMessage());
        }
    }

    private void handleMove(String[] parts, PrintStream out) {
        if (parts.length != 3) {
            out.println("Invalid input: The 'move' command requires <from> and <to> coordinates.");
            out.println("Usage: move <from_square> <to_square>");
            out.println("Example: move B1 C3");
            return;
        }
        Point from;
        Point to;
        try {
            from = gameService.parseSquare(parts[1]);
        } catch (InvalidCoordinateException e) {
            out.println("Invalid input: " + parts[1].toUpperCase(Locale.ROOT) + " is not a valid 'from' square.");
            return;
        }
        try {
            to = gameService.parseSquare(parts[2]);
        } catch (InvalidCoordinateException e) {
            out.println("Invalid input: " + parts[2].toUpperCase(Locale.ROOT) + " is not a valid 'to' square.");
            return;
        }

        try {
            MoveRecord record = gameService.move(from, to);
            StringBuilder sb = new StringBuilder("Moved ")
                    .append(record.getPiece())
                    .append(" from ").append(CoordinateCodec.format(record.getFrom()))
                    .append(" to ").append(CoordinateCodec.format(record.getTo())).append('.');
            if (record.isCapture()) {
                sb.append(" Captured ").append(record.getCaptured()).append('.');
            }
            out.println(sb);
        } catch (GameRuleException e) {
            out.println(e.getMessage());
        }
    }
}
