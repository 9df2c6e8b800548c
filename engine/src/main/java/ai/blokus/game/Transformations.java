package ai.blokus.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the distinct orientations of a shape under rotation and mirroring.
 */
public final class Transformations {
    private Transformations() {
    }

    /**
     * Enumerate the structurally distinct images of {@code shape} under the eight symmetries of the
     * square.
     * <p>
     * Mirror off is tried before mirror on; within each, four quarter turns clockwise are taken in
     * sequence from the (possibly mirrored) starting shape. A variant is kept only when its
     * {@link Shape#key()} has not been seen yet, so fully symmetric shapes yield a single entry and
     * fully asymmetric ones yield eight.
     *
     * @param shape canonical shape; must not be null
     * @return unmodifiable list of 1..8 transformations, the first being the shape itself
     */
    public static List<Transformation> of(Shape shape) {
        Objects.requireNonNull(shape, "shape");
        List<Transformation> result = new ArrayList<>(8);
        Set<String> seen = new HashSet<>();
        for (int flip = 0; flip < 2; flip++) {
            Shape current = flip == 0 ? shape : shape.mirror();
            for (int step = 0; step < 4; step++) {
                if (seen.add(current.key())) {
                    result.add(new Transformation(current, step * 90, flip == 1));
                }
                current = current.rotateClockwise();
            }
        }
        return Collections.unmodifiableList(result);
    }
}
