package ai.blokus.game;

import java.util.Objects;

/**
 * Outcome of checking one placement. Valid results carry no payload; invalid ones carry the first
 * rule that failed.
 */
public final class PlacementResult {
    private static final PlacementResult VALID = new PlacementResult(null);

    private final InvalidReason reason;

    private PlacementResult(InvalidReason reason) {
        this.reason = reason;
    }

    public static PlacementResult valid() {
        return VALID;
    }

    public static PlacementResult invalid(InvalidReason reason) {
        return new PlacementResult(Objects.requireNonNull(reason, "reason"));
    }

    public boolean isValid() {
        return reason == null;
    }

    /** The failed rule, or {@code null} for a valid placement. */
    public InvalidReason getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PlacementResult)) {
            return false;
        }
        return reason == ((PlacementResult) o).reason;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(reason);
    }

    @Override
    public String toString() {
        return isValid() ? "Valid" : "Invalid(" + reason + ")";
    }

    /**
     * Placement rules, in the order they are checked.
     */
    public enum InvalidReason {
        /** A filled cell falls outside the board. */
        OUT_OF_BOUNDS("Out of bounds"),
        /** A filled cell lands on a claimed cell. */
        OVERLAP("Overlaps existing piece"),
        /** First move misses the starting corner, or a later move has no diagonal contact with its own color. */
        MISSING_CORNER_TOUCH("Must touch corner of your pieces"),
        /** A filled cell shares an edge with the mover's own color. */
        EDGE_ADJACENCY("Cannot touch edge of your pieces");

        private final String description;

        InvalidReason(String description) {
            this.description = description;
        }

        /** Short human-readable explanation, suitable for feedback text. */
        public String description() {
            return description;
        }
    }
}
