package ai.blokus.game;

import java.util.Objects;
import java.util.Set;

/**
 * Whose turn it is and which colors are finished.
 *
 * @param current       the active color (a placeholder once {@code terminal} is set)
 * @param neutralHolder party that plays the neutral color next; always 0 outside three-party games
 * @param out           colors that have been found to have no legal placement; never shrinks
 * @param terminal      true once every color is out
 */
public record TurnState(PlayerColor current, int neutralHolder, Set<PlayerColor> out, boolean terminal) {
    public TurnState {
        Objects.requireNonNull(current, "current");
        out = Alliance.copyOf(out);
    }

    /** Opening turn: Blue to move, nobody out. */
    public static TurnState initial() {
        return new TurnState(PlayerColor.BLUE, 0, Set.of(), false);
    }

    public boolean isOut(PlayerColor color) {
        return out.contains(color);
    }
}
