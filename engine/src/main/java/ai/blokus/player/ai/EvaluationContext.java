package ai.blokus.player.ai;

import ai.blokus.game.Alliance;
import ai.blokus.game.Board;
import ai.blokus.game.GameState;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import ai.blokus.game.UsedPieces;
import java.util.Objects;

/**
 * Read-only inputs shared by every candidate while one decision is scored.
 *
 * @param board       board before the move
 * @param color       color about to move
 * @param usedPieces  placements so far
 * @param firstMove   whether this is the color's opening placement
 * @param mode        party topology
 * @param alliance    ally and opponent colors from the mover's point of view
 */
public record EvaluationContext(
        Board board,
        PlayerColor color,
        UsedPieces usedPieces,
        boolean firstMove,
        PlayerMode mode,
        Alliance alliance) {
    public EvaluationContext {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(usedPieces, "usedPieces");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(alliance, "alliance");
    }

    /** Context for {@code color} in {@code state}, with the alliance the mode assigns it. */
    public static EvaluationContext of(GameState state, PlayerColor color, PlayerMode mode) {
        return new EvaluationContext(
                state.board(),
                color,
                state.usedPieces(),
                state.isFirstMove(color),
                mode,
                mode.alliance(color, state.turn().neutralHolder()));
    }
}
