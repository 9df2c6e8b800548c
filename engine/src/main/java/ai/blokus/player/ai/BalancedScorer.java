package ai.blokus.player.ai;

import ai.blokus.game.Board;
import ai.blokus.game.Move;
import java.util.Random;

/**
 * Plays large pieces early, leans towards the centre, stays off the rim and keeps corners open.
 * Territory counts only when the mover shares its side with another color.
 */
final class BalancedScorer implements MoveScorer {
    private static final double CENTER_RADIUS = 20;
    private static final int EDGE_PENALTY = 10;
    private static final int CORNER_WEIGHT = 5;
    private static final double TERRITORY_WEIGHT = 1.5;

    @Override
    public double score(Move move, EvaluationContext context, Random random) {
        double score = 0;

        if (GamePhase.balanced(context.usedPieces().totalPlaced()) == GamePhase.EARLY) {
            score += move.cellCount() * 8 + random.nextDouble() * 12;
            score += Heuristics.varietyBonus(
                    move.piece(), context.color(), context.usedPieces(), context.alliance().opponents(), random);
        } else {
            score += move.cellCount() * 2 + random.nextDouble() * 6;
        }

        score += Heuristics.centerBonus(move, CENTER_RADIUS);

        if (Heuristics.nearBoardEdge(move)) {
            score -= EDGE_PENALTY;
        }

        Board after = context.board().place(move, context.color());
        score += Heuristics.cornerConnections(after, move, context.color(), context.alliance().allies()) * CORNER_WEIGHT;

        if (context.alliance().allies().size() > 1) {
            score += Heuristics.territory(after, context.alliance().allies()) * TERRITORY_WEIGHT;
        }

        score += random.nextDouble() * 3;
        return score;
    }
}
