package ai.blokus.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of which pieces each color has already placed, in placement order.
 * <p>
 * A color may place each piece at most once; {@link #with(PlayerColor, Piece)} refuses a repeat.
 */
public final class UsedPieces {
    private static final UsedPieces NONE = new UsedPieces(new EnumMap<>(PlayerColor.class));

    private final Map<PlayerColor, List<Piece>> placed;

    private UsedPieces(Map<PlayerColor, List<Piece>> placed) {
        this.placed = placed;
    }

    public static UsedPieces none() {
        return NONE;
    }

    /**
     * Returns a copy with {@code piece} appended to {@code color}'s placements.
     *
     * @throws IllegalStateException if the color already placed that piece
     */
    public UsedPieces with(PlayerColor color, Piece piece) {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(piece, "piece");
        if (contains(color, piece)) {
            throw new IllegalStateException(color.displayName() + " already placed " + piece);
        }
        Map<PlayerColor, List<Piece>> next = new EnumMap<>(PlayerColor.class);
        next.putAll(placed);
        List<Piece> pieces = new ArrayList<>(of(color));
        pieces.add(piece);
        next.put(color, Collections.unmodifiableList(pieces));
        return new UsedPieces(next);
    }

    /** Pieces {@code color} has placed, oldest first. */
    public List<Piece> of(PlayerColor color) {
        return placed.getOrDefault(color, Collections.emptyList());
    }

    public boolean contains(PlayerColor color, Piece piece) {
        return of(color).contains(piece);
    }

    /** Pieces {@code color} may still place, in catalog order. */
    public List<Piece> available(PlayerColor color) {
        List<Piece> used = of(color);
        List<Piece> result = new ArrayList<>();
        for (Piece piece : Piece.values()) {
            if (!used.contains(piece)) {
                result.add(piece);
            }
        }
        return result;
    }

    /** The last {@code count} pieces {@code color} placed, oldest first. */
    public List<Piece> recent(PlayerColor color, int count) {
        List<Piece> used = of(color);
        return used.subList(Math.max(0, used.size() - count), used.size());
    }

    /** Total pieces placed across all colors. */
    public int totalPlaced() {
        int total = 0;
        for (List<Piece> pieces : placed.values()) {
            total += pieces.size();
        }
        return total;
    }

    /** Cells covered by the pieces {@code color} has placed. */
    public int cellCount(PlayerColor color) {
        int total = 0;
        for (Piece piece : of(color)) {
            total += piece.size();
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UsedPieces)) {
            return false;
        }
        UsedPieces other = (UsedPieces) o;
        for (PlayerColor color : PlayerColor.values()) {
            if (!of(color).equals(other.of(color))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (PlayerColor color : PlayerColor.values()) {
            hash = 31 * hash + of(color).hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return "UsedPieces" + placed;
    }
}
