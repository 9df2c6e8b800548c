package ai.blokus.player.ai;

import ai.blokus.game.Move;
import java.util.Random;

/**
 * Mostly noise with a slight lean towards larger pieces.
 */
final class NoviceScorer implements MoveScorer {

    @Override
    public double score(Move move, EvaluationContext context, Random random) {
        int colorVariety = (context.color().id() + 1) * 3;
        return random.nextDouble() * 20
                + move.cellCount() * 2
                + colorVariety * random.nextDouble();
    }
}
