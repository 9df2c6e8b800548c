package ai.blokus.player.ai;

import ai.blokus.game.GameState;
import ai.blokus.game.Move;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import ai.blokus.player.LegalMovesHelper;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides a move for a computer-controlled color: generate every legal placement, then let the
 * {@link MoveEvaluator} pick one.
 * <p>
 * The controller returns synchronously; any deliberate thinking pause is for the caller to
 * schedule.
 */
public class AIController {
    private static final Logger log = LoggerFactory.getLogger(AIController.class);

    private final PlayerMode mode;
    private final MoveEvaluator evaluator;

    public AIController(PlayerMode mode, MoveEvaluator evaluator) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Decide a move for {@code color} in {@code state}.
     *
     * @return the chosen move, or {@code null} when the color has no legal placement
     */
    public Move decideMove(GameState state, PlayerColor color, Tier tier) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(color, "color");
        List<Move> moves = LegalMovesHelper.generateAllMoves(
                state.board(), color, state.usedPieces(), state.isFirstMove(color));
        if (moves.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("{} has no legal placement; passing", color);
            }
            return null;
        }
        return evaluator.selectMove(moves, EvaluationContext.of(state, color, mode), tier);
    }

    public PlayerMode getMode() {
        return mode;
    }
}
