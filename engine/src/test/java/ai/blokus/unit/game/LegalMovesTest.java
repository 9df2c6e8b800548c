package ai.blokus.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blokus.game.Board;
import ai.blokus.game.Cell;
import ai.blokus.game.GameState;
import ai.blokus.game.Move;
import ai.blokus.game.Piece;
import ai.blokus.game.PlacementValidator;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.UsedPieces;
import ai.blokus.player.LegalMovesHelper;
import ai.blokus.unit.helpers.BoardBuilder;
import ai.blokus.unit.helpers.TestGameStateBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Move generation and the existence probe used to mark colors out.
 */
class LegalMovesTest {

    @Test
    void everyOpeningMoveRevalidatesAndCoversTheCorner() {
        List<Move> moves = LegalMovesHelper.generateAllMoves(Board.empty(), PlayerColor.BLUE, UsedPieces.none(), true);

        assertFalse(moves.isEmpty());
        for (Move move : moves) {
            assertTrue(PlacementValidator.validate(Board.empty(), move, PlayerColor.BLUE, true).isValid(),
                    move.toString());
            assertTrue(move.cells().contains(new Cell(0, 0)), move.toString());
        }
    }

    @Test
    void openingMovesAnchorOnTheCornerForTightShapes() {
        // Shapes have tight bounding boxes, so an opening move in the top-left corner must anchor at (0,0).
        List<Move> moves = LegalMovesHelper.generateAllMoves(Board.empty(), PlayerColor.BLUE, UsedPieces.none(), true);
        int expected = 0;
        for (Piece piece : Piece.values()) {
            for (var t : piece.transformations()) {
                if (t.shape().isFilled(0, 0)) {
                    expected++;
                }
            }
        }
        assertEquals(expected, moves.size());
        for (Move move : moves) {
            assertEquals(0, move.row());
            assertEquals(0, move.col());
        }
    }

    @Test
    void onlyMonoLeftGivesExactlyOneOpeningMove() {
        GameState state = TestGameStateBuilder.state().usedAllBut(PlayerColor.GREEN, Piece.MONO).build();

        List<Move> moves = LegalMovesHelper.generateAllMoves(
                state.board(), PlayerColor.GREEN, state.usedPieces(), true);

        assertEquals(1, moves.size());
        assertEquals(Piece.MONO, moves.get(0).piece());
        assertEquals(19, moves.get(0).row());
        assertEquals(19, moves.get(0).col());
    }

    @Test
    void movesFollowCatalogOrder() {
        List<Move> moves = LegalMovesHelper.generateAllMoves(Board.empty(), PlayerColor.RED, UsedPieces.none(), true);
        int last = -1;
        for (Move move : moves) {
            assertTrue(move.piece().ordinal() >= last);
            last = move.piece().ordinal();
        }
        assertEquals(Piece.MONO, moves.get(0).piece());
    }

    @Test
    void usedPiecesAreNotOffered() {
        UsedPieces used = UsedPieces.none().with(PlayerColor.BLUE, Piece.MONO).with(PlayerColor.BLUE, Piece.X5);
        Board board = BoardBuilder.emptyBoard().cell(0, 0, PlayerColor.BLUE).build();

        List<Move> moves = LegalMovesHelper.generateAllMoves(board, PlayerColor.BLUE, used, false);

        assertFalse(moves.isEmpty());
        for (Move move : moves) {
            assertFalse(move.piece() == Piece.MONO || move.piece() == Piece.X5);
        }
    }

    @Test
    void allPiecesUsedMeansNoMoves() {
        GameState state = TestGameStateBuilder.state().usedAllBut(PlayerColor.BLUE).build();

        assertTrue(LegalMovesHelper.generateAllMoves(state.board(), PlayerColor.BLUE, state.usedPieces(), false)
                .isEmpty());
        assertFalse(LegalMovesHelper.hasAnyValidMove(state.board(), PlayerColor.BLUE, state.usedPieces(), false));
    }

    @Test
    void fullBoardMeansNoMoves() {
        Board full = BoardBuilder.filledWith(PlayerColor.RED).build();

        for (PlayerColor color : PlayerColor.values()) {
            assertTrue(LegalMovesHelper.generateAllMoves(full, color, UsedPieces.none(), false).isEmpty());
            assertFalse(LegalMovesHelper.hasAnyValidMove(full, color, UsedPieces.none(), true));
        }
    }

    @Test
    void probeFindsASingleHoleAtAnyOffset() {
        // Board full of Red except one hole at (5,7), diagonal to a lone Blue cell at (4,6).
        Board board = BoardBuilder.filledWith(PlayerColor.RED)
                .cell(4, 6, PlayerColor.BLUE)
                .cell(5, 7, null)
                .build();

        assertTrue(LegalMovesHelper.hasAnyValidMove(board, PlayerColor.BLUE, UsedPieces.none(), false));

        List<Move> moves = LegalMovesHelper.generateAllMoves(board, PlayerColor.BLUE, UsedPieces.none(), false);
        assertEquals(1, moves.size());
        assertEquals(Piece.MONO, moves.get(0).piece());
        assertEquals(5, moves.get(0).row());
        assertEquals(7, moves.get(0).col());
    }

    @Test
    void probeAgreesWithGeneratorWhenTheOnlyFitIsTheMonoAndItIsUsed() {
        Board board = BoardBuilder.filledWith(PlayerColor.RED)
                .cell(4, 6, PlayerColor.BLUE)
                .cell(5, 7, null)
                .build();
        UsedPieces used = UsedPieces.none().with(PlayerColor.BLUE, Piece.MONO);

        assertTrue(LegalMovesHelper.generateAllMoves(board, PlayerColor.BLUE, used, false).isEmpty());
        assertFalse(LegalMovesHelper.hasAnyValidMove(board, PlayerColor.BLUE, used, false));
    }

    @Test
    void blockedCornerLeavesNoOpeningMove() {
        Board board = BoardBuilder.emptyBoard().cell(0, 19, PlayerColor.BLUE).build();
        assertFalse(LegalMovesHelper.hasAnyValidMove(board, PlayerColor.RED, UsedPieces.none(), true));
        assertTrue(LegalMovesHelper.hasAnyValidMove(board, PlayerColor.GREEN, UsedPieces.none(), true));
    }
}
