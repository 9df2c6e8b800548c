package ai.blokus.player.ai;

/**
 * Coarse progress of the game, measured by pieces placed across all colors.
 */
enum GamePhase {
    EARLY,
    MID,
    LATE;

    /** Two-way split used by the balanced tier: early below 20 placements. */
    static GamePhase balanced(int totalPlaced) {
        return totalPlaced < 20 ? EARLY : LATE;
    }

    /** Three-way split used by the advanced tier: early below 16, late from 48. */
    static GamePhase advanced(int totalPlaced) {
        if (totalPlaced < 16) {
            return EARLY;
        }
        return totalPlaced < 48 ? MID : LATE;
    }
}
