package ai.blokus.game;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of everything the rules need: board, placements, pending first moves and
 * turn bookkeeping. Every change yields a new snapshot.
 *
 * @param board             current board
 * @param usedPieces        placements per color
 * @param pendingFirstMoves colors that have not placed yet
 * @param turn              turn bookkeeping
 */
public record GameState(Board board, UsedPieces usedPieces, Set<PlayerColor> pendingFirstMoves, TurnState turn) {
    public GameState {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(usedPieces, "usedPieces");
        Objects.requireNonNull(turn, "turn");
        pendingFirstMoves = Alliance.copyOf(pendingFirstMoves);
    }

    /** Empty board, nothing placed, every color awaiting its opening move, Blue to play. */
    public static GameState initial() {
        return new GameState(Board.empty(), UsedPieces.none(), EnumSet.allOf(PlayerColor.class), TurnState.initial());
    }

    public boolean isFirstMove(PlayerColor color) {
        return pendingFirstMoves.contains(color);
    }

    /**
     * Snapshot after {@code color} commits {@code move}. The turn is left unchanged; the caller
     * advances it.
     */
    public GameState afterPlacement(Move move, PlayerColor color) {
        Set<PlayerColor> pending = EnumSet.noneOf(PlayerColor.class);
        pending.addAll(pendingFirstMoves);
        pending.remove(color);
        return new GameState(board.place(move, color), usedPieces.with(color, move.piece()), pending, turn);
    }

    public GameState withTurn(TurnState nextTurn) {
        return new GameState(board, usedPieces, pendingFirstMoves, nextTurn);
    }
}
