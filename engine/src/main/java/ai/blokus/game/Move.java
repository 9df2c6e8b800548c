package ai.blokus.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A candidate or committed placement: which piece, in which orientation, anchored where.
 * <p>
 * The anchor is the top-left corner of the transformation's bounding box and may lie off the
 * board as long as every filled cell lands on it. The transformation must be one of the piece's own
 * orientations, so the cells placed always match the piece recorded.
 *
 * @param piece          the piece being placed
 * @param transformation orientation of the piece
 * @param row            anchor row
 * @param col            anchor column
 */
public record Move(Piece piece, Transformation transformation, int row, int col) {
    public Move {
        Objects.requireNonNull(piece, "piece");
        Objects.requireNonNull(transformation, "transformation");
        if (!piece.transformations().contains(transformation)) {
            throw new IllegalArgumentException(
                    "Orientation " + transformation.shape().key() + " is not an orientation of " + piece);
        }
    }

    public Shape shape() {
        return transformation.shape();
    }

    /** Bounding-box height. */
    public int height() {
        return transformation.shape().height();
    }

    /** Bounding-box width. */
    public int width() {
        return transformation.shape().width();
    }

    public int cellCount() {
        return piece.size();
    }

    /** Absolute board cells covered by this placement. */
    public List<Cell> cells() {
        List<Cell> relative = transformation.shape().cells();
        List<Cell> absolute = new ArrayList<>(relative.size());
        for (Cell cell : relative) {
            absolute.add(cell.offset(row, col));
        }
        return absolute;
    }

    @Override
    public String toString() {
        return piece + "@" + row + "," + col
                + " rot=" + transformation.rotation()
                + (transformation.mirrored() ? " mirrored" : "");
    }
}
