package ai.blokus.game;

import java.util.Objects;

/**
 * One oriented variant of a piece.
 * <p>
 * {@code rotation} and {@code mirrored} describe how the variant was reached during enumeration
 * and exist for display only. They do not compose reliably; the {@link #shape()} matrix is the only
 * authoritative geometry.
 *
 * @param shape    oriented shape
 * @param rotation rotation label in degrees: 0, 90, 180 or 270
 * @param mirrored whether the canonical shape was flipped before rotating
 */
public record Transformation(Shape shape, int rotation, boolean mirrored) {
    public Transformation {
        Objects.requireNonNull(shape, "shape");
        if (rotation != 0 && rotation != 90 && rotation != 180 && rotation != 270) {
            throw new IllegalArgumentException("Rotation label must be 0, 90, 180 or 270: " + rotation);
        }
    }
}
