package ai.blokus.player.ai;

import ai.blokus.game.Board;
import ai.blokus.game.Move;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import java.util.Random;
import java.util.Set;

/**
 * Full heuristic set: ally territory, ally synergy (two parties), phase-dependent piece sizing,
 * centre pull, corner flexibility, blocking opponents' diagonals and late-game connectivity.
 */
final class AdvancedScorer implements MoveScorer {
    private static final int TERRITORY_WEIGHT = 3;
    private static final int SYNERGY_WEIGHT = 4;
    private static final double CENTER_RADIUS = 25;
    private static final double LATE_CENTER_RADIUS = 10;
    private static final int CORNER_WEIGHT = 8;
    private static final int BLOCKING_WEIGHT = 6;
    private static final int THREE_PARTY_BLOCKING_WEIGHT = 8;
    private static final int CONNECTIVITY_WEIGHT = 5;

    @Override
    public double score(Move move, EvaluationContext context, Random random) {
        PlayerColor color = context.color();
        Set<PlayerColor> allies = context.alliance().allies();
        GamePhase phase = GamePhase.advanced(context.usedPieces().totalPlaced());
        Board after = context.board().place(move, color);
        double score = 0;

        score += Heuristics.territory(after, allies) * TERRITORY_WEIGHT;

        if (context.mode() == PlayerMode.TWO_PARTY && allies.size() == 2) {
            PlayerColor otherAlly = otherAlly(allies, color);
            if (otherAlly != null) {
                score += Heuristics.synergy(after, color, otherAlly) * SYNERGY_WEIGHT;
            }
        }

        score += sizeScore(move, phase, context, random);

        double radius = phase == GamePhase.LATE ? LATE_CENTER_RADIUS : CENTER_RADIUS;
        score += Heuristics.centerBonus(move, radius);

        score += Heuristics.cornerConnections(after, move, color, allies) * CORNER_WEIGHT;

        int blockingWeight = context.mode() == PlayerMode.THREE_PARTY ? THREE_PARTY_BLOCKING_WEIGHT : BLOCKING_WEIGHT;
        score += Heuristics.blockingValue(context.board(), after, context.alliance().opponents()) * blockingWeight;

        if (phase == GamePhase.LATE) {
            score += Heuristics.connectivity(after, move, allies) * CONNECTIVITY_WEIGHT;
        }

        score += random.nextDouble() * 2;
        return score;
    }

    private double sizeScore(Move move, GamePhase phase, EvaluationContext context, Random random) {
        int size = move.cellCount();
        switch (phase) {
            case EARLY: {
                double score;
                if (size == 5) {
                    score = 15 + random.nextDouble() * 10;
                } else if (size == 4) {
                    score = 10 + random.nextDouble() * 8;
                } else {
                    score = 3 + random.nextDouble() * 5;
                }
                return score + Heuristics.varietyBonus(
                        move.piece(), context.color(), context.usedPieces(), context.alliance().opponents(), random);
            }
            case MID:
                return size * 4 + random.nextDouble() * 6;
            default:
                if (size <= 2) {
                    return 20 + random.nextDouble() * 5;
                }
                return size * 2 + random.nextDouble() * 4;
        }
    }

    private static PlayerColor otherAlly(Set<PlayerColor> allies, PlayerColor color) {
        for (PlayerColor ally : allies) {
            if (ally != color) {
                return ally;
            }
        }
        return null;
    }
}
