package ai.blokus.game;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores are the number of board cells covered: per color, summed per party.
 */
public final class Scoring {
    private Scoring() {
    }

    public static int colorScore(UsedPieces usedPieces, PlayerColor color) {
        return usedPieces.cellCount(color);
    }

    public static int partyScore(PlayerMode mode, UsedPieces usedPieces, int party) {
        int total = 0;
        for (PlayerColor color : mode.colorsOf(party)) {
            total += colorScore(usedPieces, color);
        }
        return total;
    }

    /**
     * Final table: parties ordered by score, highest first (ties keep party order). In three-party
     * games the neutral color gets its own row at the end.
     */
    public static List<Standing> standings(PlayerMode mode, UsedPieces usedPieces) {
        List<Standing> rows = new ArrayList<>();
        for (int party = 0; party < mode.partyCount(); party++) {
            rows.add(new Standing(
                    party,
                    "Player " + (party + 1),
                    mode.colorsOf(party),
                    partyScore(mode, usedPieces, party),
                    false));
        }
        rows.sort(Comparator.comparingInt(Standing::score).reversed());

        PlayerColor neutral = mode.neutralColor();
        if (neutral != null) {
            rows.add(new Standing(-1, "Neutral", List.of(neutral), colorScore(usedPieces, neutral), true));
        }
        return rows;
    }
}
