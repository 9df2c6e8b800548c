package ai.blokus.game;

import java.util.List;

/**
 * One row of the score table.
 *
 * @param party   0-based party index, or -1 for the neutral color's row
 * @param name    display name
 * @param colors  colors whose cells count towards this row
 * @param score   cells covered
 * @param neutral true for the neutral color's row, which does not compete
 */
public record Standing(int party, String name, List<PlayerColor> colors, int score, boolean neutral) {
    public Standing {
        colors = List.copyOf(colors);
    }
}
