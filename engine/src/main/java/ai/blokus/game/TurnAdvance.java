package ai.blokus.game;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of handing the turn on from one color.
 *
 * @param nextColor     the color to move next, or a placeholder when {@code terminal}
 * @param out           updated out set, including any colors skipped on the way
 * @param neutralHolder updated neutral pointer
 * @param terminal      true when no color can move any more
 * @param skipped       colors newly marked out by this advance, in the order they were passed
 */
public record TurnAdvance(
        PlayerColor nextColor, Set<PlayerColor> out, int neutralHolder, boolean terminal, List<PlayerColor> skipped) {
    public TurnAdvance {
        Objects.requireNonNull(nextColor, "nextColor");
        out = Alliance.copyOf(out);
        skipped = List.copyOf(skipped);
    }

    public TurnState toTurnState() {
        return new TurnState(nextColor, neutralHolder, out, terminal);
    }
}
