package ai.blokus.game;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * The 21 polyomino pieces every color starts with.
 * <p>
 * Grouped by size: one monomino, one domino, two trominoes, five tetrominoes and twelve
 * pentominoes (89 cells in total). Each constant carries its canonical shape and lazily caches the
 * distinct orientations produced by {@link Transformations#of(Shape)}.
 */
public enum Piece {
    MONO(new int[][] {{1}}),
    DOMINO(new int[][] {{1, 1}}),

    I3(new int[][] {{1, 1, 1}}),
    L3(new int[][] {
        {1, 0},
        {1, 1}}),

    I4(new int[][] {{1, 1, 1, 1}}),
    O4(new int[][] {
        {1, 1},
        {1, 1}}),
    T4(new int[][] {
        {1, 1, 1},
        {0, 1, 0}}),
    L4(new int[][] {
        {1, 0},
        {1, 0},
        {1, 1}}),
    S4(new int[][] {
        {0, 1, 1},
        {1, 1, 0}}),

    I5(new int[][] {{1, 1, 1, 1, 1}}),
    L5(new int[][] {
        {1, 0},
        {1, 0},
        {1, 0},
        {1, 1}}),
    Y5(new int[][] {
        {0, 1},
        {1, 1},
        {0, 1},
        {0, 1}}),
    N5(new int[][] {
        {0, 1},
        {0, 1},
        {1, 1},
        {1, 0}}),
    V5(new int[][] {
        {1, 0, 0},
        {1, 0, 0},
        {1, 1, 1}}),
    T5(new int[][] {
        {1, 1, 1},
        {0, 1, 0},
        {0, 1, 0}}),
    Z5(new int[][] {
        {1, 1, 0},
        {0, 1, 0},
        {0, 1, 1}}),
    P5(new int[][] {
        {1, 1},
        {1, 1},
        {1, 0}}),
    W5(new int[][] {
        {1, 0, 0},
        {1, 1, 0},
        {0, 1, 1}}),
    U5(new int[][] {
        {1, 0, 1},
        {1, 1, 1}}),
    F5(new int[][] {
        {0, 1, 1},
        {1, 1, 0},
        {0, 1, 0}}),
    X5(new int[][] {
        {0, 1, 0},
        {1, 1, 1},
        {0, 1, 0}});

    /** Catalog ordered by cell count, smallest first; ties keep declaration order. */
    private static final List<Piece> SMALLEST_FIRST = Arrays.stream(values())
            .sorted(Comparator.comparingInt(Piece::size))
            .toList();

    private final Shape shape;
    private volatile List<Transformation> transformations;

    Piece(int[][] rows) {
        this.shape = Shape.of(rows);
    }

    /** Canonical shape as listed in the catalog. */
    public Shape shape() {
        return shape;
    }

    /** Number of cells this piece covers (1..5). */
    public int size() {
        return shape.cellCount();
    }

    /** Distinct orientations of this piece, computed once. */
    public List<Transformation> transformations() {
        List<Transformation> cached = transformations;
        if (cached == null) {
            cached = Transformations.of(shape);
            transformations = cached;
        }
        return cached;
    }

    public static List<Piece> smallestFirst() {
        return SMALLEST_FIRST;
    }

    /** Total cells across the whole set. */
    public static int totalCells() {
        int total = 0;
        for (Piece piece : values()) {
            total += piece.size();
        }
        return total;
    }
}
