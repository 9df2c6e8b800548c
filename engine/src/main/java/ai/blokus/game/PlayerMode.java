package ai.blokus.game;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * How the four colors are shared between controlling parties.
 * <ul>
 *   <li>{@link #TWO_PARTY}: each party owns two diagonal colors (Blue+Green, Red+Yellow).</li>
 *   <li>{@link #THREE_PARTY}: parties 0..2 own Blue, Red and Green; Yellow is neutral and is played
 *       by whichever party currently holds it.</li>
 *   <li>{@link #FOUR_PARTY}: one color per party.</li>
 * </ul>
 * Party indices are 0-based.
 */
public enum PlayerMode {
    TWO_PARTY(2, null, List.of(
            List.of(PlayerColor.BLUE, PlayerColor.GREEN),
            List.of(PlayerColor.RED, PlayerColor.YELLOW))),
    THREE_PARTY(3, PlayerColor.YELLOW, List.of(
            List.of(PlayerColor.BLUE),
            List.of(PlayerColor.RED),
            List.of(PlayerColor.GREEN))),
    FOUR_PARTY(4, null, List.of(
            List.of(PlayerColor.BLUE),
            List.of(PlayerColor.RED),
            List.of(PlayerColor.GREEN),
            List.of(PlayerColor.YELLOW)));

    private final int partyCount;
    private final PlayerColor neutralColor;
    private final List<List<PlayerColor>> partyColors;

    PlayerMode(int partyCount, PlayerColor neutralColor, List<List<PlayerColor>> partyColors) {
        this.partyCount = partyCount;
        this.neutralColor = neutralColor;
        this.partyColors = partyColors;
    }

    /**
     * Resolve a mode from a party count.
     *
     * @throws IllegalArgumentException unless the count is 2, 3 or 4
     */
    public static PlayerMode forPartyCount(int partyCount) {
        for (PlayerMode mode : values()) {
            if (mode.partyCount == partyCount) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported party count: " + partyCount);
    }

    public int partyCount() {
        return partyCount;
    }

    /** The neutral color, or {@code null} when every color is owned. */
    public PlayerColor neutralColor() {
        return neutralColor;
    }

    public boolean isNeutral(PlayerColor color) {
        return neutralColor != null && neutralColor == color;
    }

    /** Colors permanently owned by {@code party}. */
    public List<PlayerColor> colorsOf(int party) {
        if (party < 0 || party >= partyCount) {
            throw new IllegalArgumentException("Unknown party " + party + " for " + this);
        }
        return partyColors.get(party);
    }

    /**
     * The party that plays {@code color} right now.
     *
     * @param neutralHolder party currently holding the neutral color; ignored outside
     *                      {@link #THREE_PARTY}
     */
    public int controllingParty(PlayerColor color, int neutralHolder) {
        if (isNeutral(color)) {
            return neutralHolder;
        }
        for (int party = 0; party < partyCount; party++) {
            if (partyColors.get(party).contains(color)) {
                return party;
            }
        }
        throw new IllegalStateException(color + " has no owner in " + this);
    }

    /**
     * Partition the colors into allies and opponents from the point of view of {@code color}.
     * <p>
     * Two parties: allies are the party's two colors, opponents the other party's two. Three
     * parties: when playing the neutral color, allies are the holder's own color plus the neutral
     * color and opponents are the other two parties' colors; when playing an owned color, allies are
     * just that color and every other color (neutral included) is an opponent. Four parties: allies
     * are the color itself, opponents the other three.
     */
    public Alliance alliance(PlayerColor color, int neutralHolder) {
        Set<PlayerColor> allies = EnumSet.noneOf(PlayerColor.class);
        Set<PlayerColor> opponents = EnumSet.noneOf(PlayerColor.class);
        if (isNeutral(color)) {
            allies.addAll(colorsOf(neutralHolder));
            allies.add(color);
            for (int party = 0; party < partyCount; party++) {
                if (party != neutralHolder) {
                    opponents.addAll(colorsOf(party));
                }
            }
        } else {
            allies.addAll(colorsOf(controllingParty(color, neutralHolder)));
            for (PlayerColor other : PlayerColor.values()) {
                if (!allies.contains(other)) {
                    opponents.add(other);
                }
            }
        }
        return new Alliance(allies, opponents);
    }
}
