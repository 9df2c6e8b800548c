package ai.blokus.player.ai;

/**
 * Difficulty tiers for computer-controlled colors.
 * <p>
 * Every tier scores all legal moves and then picks uniformly at random among the best few; the
 * tiers differ in which heuristics they weigh and in how wide that final pool is.
 */
public enum Tier {
    /** Size preference plus heavy noise; picks from the top 40%. */
    NOVICE,
    /** Size, centre, edge avoidance, corner flexibility and ally territory; picks from the top 5. */
    BALANCED,
    /** Full heuristic set with game phases, blocking and ally synergy; picks from the top 3. */
    ADVANCED;

    /**
     * How many of the best-scored moves the final random pick is drawn from.
     *
     * @param moveCount number of legal moves; must be positive
     */
    public int candidatePoolSize(int moveCount) {
        return switch (this) {
            case NOVICE -> Math.max(1, (int) Math.floor(moveCount * 0.4));
            case BALANCED -> Math.min(5, moveCount);
            case ADVANCED -> Math.min(3, moveCount);
        };
    }
}
