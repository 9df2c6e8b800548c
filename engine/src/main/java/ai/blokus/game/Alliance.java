package ai.blokus.game;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The colors working with and against the color about to move.
 *
 * @param allies    colors controlled by the same party, including the moving color where it is owned
 * @param opponents colors controlled by other parties
 */
public record Alliance(Set<PlayerColor> allies, Set<PlayerColor> opponents) {
    public Alliance {
        allies = copyOf(allies);
        opponents = copyOf(opponents);
    }

    public boolean isAlly(PlayerColor color) {
        return color != null && allies.contains(color);
    }

    public boolean isOpponent(PlayerColor color) {
        return color != null && opponents.contains(color);
    }

    static Set<PlayerColor> copyOf(Set<PlayerColor> colors) {
        return colors.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(PlayerColor.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(colors));
    }
}
