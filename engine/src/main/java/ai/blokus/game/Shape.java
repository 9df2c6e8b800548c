package ai.blokus.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable rectangular 0/1 matrix describing which cells of a bounding box a piece fills.
 * <p>
 * Shapes compare by structure: two shapes are equal when they have the same dimensions and the
 * same filled cells, regardless of how they were derived. {@link #key()} is the canonical
 * row-major string form used for de-duplication (rows joined with {@code |}, e.g. {@code "011|110|010"}).
 */
public final class Shape {
    private final int height;
    private final int width;
    private final boolean[] filled;
    private final int cellCount;
    private final List<Cell> cells;
    private final String key;

    private Shape(int height, int width, boolean[] filled) {
        this.height = height;
        this.width = width;
        this.filled = filled;

        List<Cell> list = new ArrayList<>();
        StringBuilder sb = new StringBuilder(height * (width + 1));
        for (int r = 0; r < height; r++) {
            if (r > 0) {
                sb.append('|');
            }
            for (int c = 0; c < width; c++) {
                boolean on = filled[r * width + c];
                sb.append(on ? '1' : '0');
                if (on) {
                    list.add(new Cell(r, c));
                }
            }
        }
        this.cells = Collections.unmodifiableList(list);
        this.cellCount = list.size();
        this.key = sb.toString();
    }

    /**
     * Build a shape from a matrix of 0/1 values.
     *
     * @param rows non-empty rectangular matrix; any non-zero value counts as filled
     * @throws IllegalArgumentException if the matrix is empty or ragged
     */
    public static Shape of(int[][] rows) {
        Objects.requireNonNull(rows, "rows");
        if (rows.length == 0 || rows[0].length == 0) {
            throw new IllegalArgumentException("Shape must have at least one row and column");
        }
        int height = rows.length;
        int width = rows[0].length;
        boolean[] filled = new boolean[height * width];
        for (int r = 0; r < height; r++) {
            if (rows[r].length != width) {
                throw new IllegalArgumentException("Shape rows must all have width " + width);
            }
            for (int c = 0; c < width; c++) {
                filled[r * width + c] = rows[r][c] != 0;
            }
        }
        return new Shape(height, width, filled);
    }

    public int height() {
        return height;
    }

    public int width() {
        return width;
    }

    /** Number of filled cells. */
    public int cellCount() {
        return cellCount;
    }

    public boolean isFilled(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            return false;
        }
        return filled[row * width + col];
    }

    /** Filled cells relative to the bounding-box origin, in row-major order. */
    public List<Cell> cells() {
        return cells;
    }

    /** Canonical row-major string form. */
    public String key() {
        return key;
    }

    /**
     * Returns this shape rotated 90 degrees clockwise.
     * <p>
     * Cell {@code (r, c)} moves to {@code (c, height - 1 - r)}.
     */
    public Shape rotateClockwise() {
        boolean[] rotated = new boolean[filled.length];
        int newWidth = height;
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                rotated[c * newWidth + (height - 1 - r)] = filled[r * width + c];
            }
        }
        return new Shape(width, newWidth, rotated);
    }

    /** Returns this shape flipped left to right. */
    public Shape mirror() {
        boolean[] flipped = new boolean[filled.length];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                flipped[r * width + (width - 1 - c)] = filled[r * width + c];
            }
        }
        return new Shape(height, width, flipped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Shape)) {
            return false;
        }
        Shape other = (Shape) o;
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return "Shape(" + key + ")";
    }
}
