package ai.blokus.player.ai;

import ai.blokus.game.Move;
import java.util.Random;

/**
 * Assigns a desirability score to one legal move. Higher is better.
 * <p>
 * Implementations must not keep state between calls; all randomness comes from the supplied
 * {@link Random}.
 */
interface MoveScorer {

    double score(Move move, EvaluationContext context, Random random);
}
