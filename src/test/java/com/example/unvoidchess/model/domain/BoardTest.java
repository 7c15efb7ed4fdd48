package com.example.unvoidchess.model.domain;

import com.example.unvoidchess.exception.IllegalDestinationException;
import com.example.unvoidchess.exception.NoPieceException;
import com.example.unvoidchess.exception.SameSquareException;
import com.example.unvoidchess.exception.WrongColorException;
import com.example.unvoidchess.logic.CoordinateCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BoardTest {

    private static final Piece WHITE_ROYAL = new Piece(PieceType.ROYAL, PlayerColor.FIRST);
    private static final Piece WHITE_RUNNER = new Piece(PieceType.RUNNER, PlayerColor.FIRST);
    private static final Piece WHITE_LEAPER = new Piece(PieceType.LEAPER, PlayerColor.FIRST);
    private static final Piece BLACK_ROYAL = new Piece(PieceType.ROYAL, PlayerColor.SECOND);
    private static final Piece BLACK_RUNNER = new Piece(PieceType.RUNNER, PlayerColor.SECOND);
    private static final Piece BLACK_LEAPER = new Piece(PieceType.LEAPER, PlayerColor.SECOND);

    private Board board;

    @BeforeEach
    void setUp() {
        board = new Board(8, 6);
    }

    @Test
    void testInitialLayout() {
        assertEquals(Optional.of(WHITE_ROYAL), board.getPiece(0, 0));
        assertEquals(Optional.of(WHITE_RUNNER), board.getPiece(0, 1));
        assertEquals(Optional.of(WHITE_LEAPER), board.getPiece(0, 2));

        assertEquals(Optional.of(BLACK_ROYAL), board.getPiece(5, 7));
        assertEquals(Optional.of(BLACK_RUNNER), board.getPiece(5, 6));
        assertEquals(Optional.of(BLACK_LEAPER), board.getPiece(5, 5));

        assertEquals(6, Arrays.stream(board.view()).flatMap(Arrays::stream).filter(p -> p != null).count());
    }

    @Test
    void testGetPieceOffBoardIsEmpty() {
        assertTrue(board.getPiece(-1, 0).isEmpty());
        assertTrue(board.getPiece(6, 0).isEmpty());
        assertTrue(board.getPiece(0, 8).isEmpty());
        assertTrue(board.getPiece(3, 3).isEmpty());
        assertTrue(board.getPiece(0, -1).isEmpty());
    }

    @Test
    void testInitialRunnerMoves() {
        List<MoveDetail> moves = board.legalMoves(0, 1, WHITE_RUNNER);

        assertEquals(Set.of("A2", "B2", "B3", "B4", "C2", "D3", "E4"), labels(moves));
        assertTrue(moves.stream().noneMatch(MoveDetail::capture));
    }

    @Test
    void testInitialRoyalAndLeaperMoves() {
        assertEquals(Set.of("A2", "B2"), labels(board.legalMoves(0, 0, WHITE_ROYAL)));
        assertEquals(Set.of("A2", "B3", "D3", "E2"), labels(board.legalMoves(0, 2, WHITE_LEAPER)));
    }

    @Test
    void testRunnerCapturesByJumpingOverLoneOpponent() {
        BoardFixtures.clear(board);
        board.setPiece(2, 2, WHITE_RUNNER);
        board.setPiece(3, 2, BLACK_LEAPER);

        List<MoveDetail> moves = board.legalMoves(2, 2, WHITE_RUNNER);
        MoveDetail jump = find(moves, 4, 2);
        assertTrue(jump.capture());
        assertEquals(new Point(3, 2), jump.jumpedPiece());
        assertTrue(find(moves, 5, 2).capture());
        assertTrue(moves.stream().noneMatch(m -> m.targets(3, 2)));

        Optional<Piece> captured = board.movePiece(2, 2, 4, 2, PlayerColor.FIRST, moves);

        assertEquals(Optional.of(BLACK_LEAPER), captured);
        assertTrue(board.getPiece(3, 2).isEmpty());
        assertTrue(board.getPiece(2, 2).isEmpty());
        assertEquals(Optional.of(WHITE_RUNNER), board.getPiece(4, 2));
    }

    @Test
    void testRunnerCannotJumpTwoOpponents() {
        BoardFixtures.clear(board);
        board.setPiece(1, 1, WHITE_RUNNER);
        board.setPiece(2, 1, BLACK_LEAPER);
        board.setPiece(3, 1, BLACK_RUNNER);

        List<MoveDetail> moves = board.legalMoves(1, 1, WHITE_RUNNER);

        assertTrue(moves.stream().noneMatch(m -> m.toC() == 1 && m.toR() > 1));
    }

    @Test
    void testRunnerCannotJumpOwnPiece() {
        BoardFixtures.clear(board);
        board.setPiece(1, 1, WHITE_RUNNER);
        board.setPiece(1, 2, WHITE_LEAPER);
        board.setPiece(1, 4, BLACK_LEAPER);

        List<MoveDetail> moves = board.legalMoves(1, 1, WHITE_RUNNER);

        assertTrue(moves.stream().noneMatch(m -> m.toR() == 1 && m.toC() > 1));
        // leftwards is open
        assertEquals(MoveDetail.plain(1, 0), find(moves, 1, 0));
    }

    @Test
    void testLandingCaptures() {
        BoardFixtures.clear(board);
        board.setPiece(2, 2, WHITE_ROYAL);
        board.setPiece(3, 3, BLACK_RUNNER);
        board.setPiece(2, 3, WHITE_LEAPER);
        board.setPiece(4, 4, BLACK_LEAPER);

        List<MoveDetail> royalMoves = board.legalMoves(2, 2, WHITE_ROYAL);
        assertEquals(MoveDetail.landing(3, 3), find(royalMoves, 3, 3));
        assertTrue(royalMoves.stream().noneMatch(m -> m.targets(2, 3)));
        assertEquals(7, royalMoves.size());

        List<MoveDetail> leaperMoves = board.legalMoves(2, 3, WHITE_LEAPER);
        assertEquals(MoveDetail.landing(4, 4), find(leaperMoves, 4, 4));

        Optional<Piece> captured = board.movePiece(2, 3, 4, 4, PlayerColor.FIRST, leaperMoves);
        assertEquals(Optional.of(BLACK_LEAPER), captured);
        assertEquals(Optional.of(WHITE_LEAPER), board.getPiece(4, 4));
    }

    @Test
    void testGeneratedMovesRespectOccupancyRules() {
        Random random = new Random(42);
        Piece[] pieces = {WHITE_RUNNER, WHITE_LEAPER, BLACK_RUNNER, BLACK_LEAPER, BLACK_ROYAL};
        for (int round = 0; round < 20; round++) {
            Board b = new Board(6 + random.nextInt(7), 6 + random.nextInt(7));
            for (int i = 0; i < 12; i++) {
                b.setPiece(random.nextInt(b.getHeight()), random.nextInt(b.getWidth()),
                        pieces[random.nextInt(pieces.length)]);
            }
            for (int r = 0; r < b.getHeight(); r++) {
                for (int c = 0; c < b.getWidth(); c++) {
                    for (PieceType type : PieceType.values()) {
                        for (PlayerColor color : PlayerColor.values()) {
                            assertMovesWellFormed(b, r, c, new Piece(type, color));
                        }
                    }
                }
            }
        }
    }

    @Test
    void testFailedMovesLeaveBoardUntouched() {
        Piece[][] before = board.view();
        List<MoveDetail> runnerMoves = board.legalMoves(0, 1, WHITE_RUNNER);

        assertThrows(NoPieceException.class,
                () -> board.movePiece(3, 3, 4, 4, PlayerColor.FIRST, runnerMoves));
        assertThrows(WrongColorException.class,
                () -> board.movePiece(0, 1, 1, 1, PlayerColor.SECOND, runnerMoves));
        assertThrows(SameSquareException.class,
                () -> board.movePiece(0, 1, 0, 1, PlayerColor.FIRST, runnerMoves));
        assertThrows(IllegalDestinationException.class,
                () -> board.movePiece(0, 1, 0, 2, PlayerColor.FIRST, runnerMoves));
        assertThrows(IllegalDestinationException.class,
                () -> board.movePiece(0, 1, 5, 1, PlayerColor.FIRST, runnerMoves));

        assertTrue(Arrays.deepEquals(before, board.view()));
        assertEquals(Optional.of(WHITE_RUNNER), board.getPiece(0, 1));
    }

    @Test
    void testRunnerCaptureWithoutJumpedSquareIsRejected() {
        Piece[][] before = board.view();
        List<MoveDetail> broken = List.of(new MoveDetail(1, 1, true, null));

        assertThrows(IllegalStateException.class,
                () -> board.movePiece(0, 1, 1, 1, PlayerColor.FIRST, broken));
        assertTrue(Arrays.deepEquals(before, board.view()));
    }

    @Test
    void testPublicAccessorsCannotMutateGrid() {
        Piece[][] snapshot = board.view();
        snapshot[1][1] = WHITE_ROYAL;
        snapshot[0][0] = null;

        assertTrue(board.getPiece(1, 1).isEmpty());
        assertEquals(Optional.of(WHITE_ROYAL), board.getPiece(0, 0));
        assertEquals(List.of(new Point(0, 0)), BoardFixtures.findPieces(board, PieceType.ROYAL, PlayerColor.FIRST));

        for (Method m : Board.class.getMethods()) {
            assertNotEquals(Square[][].class, m.getReturnType(), m.getName() + " exposes the grid");
            assertNotEquals(Square.class, m.getReturnType(), m.getName() + " exposes a square");
            assertNotEquals("setPiece", m.getName());
        }
    }

    private void assertMovesWellFormed(Board b, int r, int c, Piece piece) {
        for (MoveDetail m : b.legalMoves(r, c, piece)) {
            assertTrue(b.inBounds(m.toR(), m.toC()), "off-board move " + m);
            Optional<Piece> target = b.getPiece(m.toR(), m.toC());
            if (piece.type() == PieceType.RUNNER) {
                assertTrue(target.isEmpty(), "runner landed on a piece " + m);
                if (m.capture()) {
                    Point j = m.jumpedPiece();
                    assertNotNull(j);
                    assertTrue(b.getPiece(j.r(), j.c()).map(piece::isOpponentOf).orElse(false));
                    assertTrue(isStrictlyBetween(r, c, m.toR(), m.toC(), j), "jumped square not on path " + m);
                } else {
                    assertNull(m.jumpedPiece());
                }
            } else {
                assertTrue(target.map(piece::isOpponentOf).orElse(true), "landed on own piece " + m);
                assertEquals(target.isPresent(), m.capture());
                assertNull(m.jumpedPiece());
            }
        }
    }

    private boolean isStrictlyBetween(int fromR, int fromC, int toR, int toC, Point p) {
        int dist = Math.max(Math.abs(toR - fromR), Math.abs(toC - fromC));
        int dr = Integer.signum(toR - fromR);
        int dc = Integer.signum(toC - fromC);
        for (int step = 1; step < dist; step++) {
            if (fromR + dr * step == p.r() && fromC + dc * step == p.c()) {
                return true;
            }
        }
        return false;
    }

    private static MoveDetail find(List<MoveDetail> moves, int r, int c) {
        return moves.stream().filter(m -> m.targets(r, c)).findFirst()
                .orElseThrow(() -> new AssertionError("no move to " + CoordinateCodec.format(r, c)));
    }

    private static Set<String> labels(List<MoveDetail> moves) {
        return moves.stream().map(m -> CoordinateCodec.format(m.toR(), m.toC())).collect(Collectors.toSet());
    }
}
