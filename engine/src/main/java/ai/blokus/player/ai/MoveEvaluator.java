package ai.blokus.player.ai;

import ai.blokus.game.Move;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks one move from a list of legal moves according to a {@link Tier}.
 * <p>
 * Each candidate is scored independently by the tier's scorer, the list is sorted by score
 * (highest first, stable for equal scores) and the result is drawn uniformly from the top
 * {@link Tier#candidatePoolSize(int)} entries. All randomness comes from the {@link Random} given
 * at construction, so a fixed seed and identical inputs reproduce the same choice.
 */
public class MoveEvaluator {
    private static final Logger log = LoggerFactory.getLogger(MoveEvaluator.class);

    private final Random random;
    private final Map<Tier, MoveScorer> scorers = new EnumMap<>(Tier.class);

    public MoveEvaluator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        scorers.put(Tier.NOVICE, new NoviceScorer());
        scorers.put(Tier.BALANCED, new BalancedScorer());
        scorers.put(Tier.ADVANCED, new AdvancedScorer());
    }

    /**
     * Choose a move.
     *
     * @param moves   legal moves for {@code context.color()}
     * @param context shared evaluation inputs
     * @param tier    difficulty tier
     * @return the chosen move, or {@code null} when {@code moves} is empty (the caller should pass)
     */
    public Move selectMove(List<Move> moves, EvaluationContext context, Tier tier) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(tier, "tier");
        if (moves == null || moves.isEmpty()) {
            return null;
        }

        List<ScoredMove> ranked = rank(moves, context, tier);
        int pool = tier.candidatePoolSize(ranked.size());
        ScoredMove pick = ranked.get(random.nextInt(pool));

        if (log.isDebugEnabled()) {
            log.debug("{} ({}) chose {} score={} from top {} of {} (best={})",
                    context.color(), tier, pick.move(), String.format("%.2f", pick.score()),
                    pool, ranked.size(), String.format("%.2f", ranked.get(0).score()));
        }
        return pick.move();
    }

    /**
     * Score every move and return them ordered best first.
     */
    public List<ScoredMove> rank(List<Move> moves, EvaluationContext context, Tier tier) {
        MoveScorer scorer = scorers.get(tier);
        List<ScoredMove> scored = new ArrayList<>(moves.size());
        for (Move move : moves) {
            scored.add(new ScoredMove(move, scorer.score(move, context, random)));
        }
        scored.sort(Comparator.comparingDouble(ScoredMove::score).reversed());
        return scored;
    }

    /**
     * A move with its heuristic score.
     */
    public record ScoredMove(Move move, double score) {
    }
}
