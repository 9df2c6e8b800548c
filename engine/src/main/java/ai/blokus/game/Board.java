package ai.blokus.game;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 20×20 grid of cells, each empty or claimed by one {@link PlayerColor}.
 * <p>
 * Boards are value snapshots: {@link #place(Shape, int, int, PlayerColor)} and friends return a new
 * board and leave the receiver untouched. This is what lets search code simulate placements freely
 * and what lets the session keep earlier boards on its undo stack without copying.
 */
public final class Board {
    public static final int SIZE = 20;
    public static final int CELL_COUNT = SIZE * SIZE;

    private static final byte EMPTY = -1;
    private static final PlayerColor[] COLORS = PlayerColor.values();
    private static final Board EMPTY_BOARD;

    static {
        byte[] cells = new byte[CELL_COUNT];
        Arrays.fill(cells, EMPTY);
        EMPTY_BOARD = new Board(cells);
    }

    private final byte[] cells;

    private Board(byte[] cells) {
        this.cells = cells;
    }

    public static Board empty() {
        return EMPTY_BOARD;
    }

    /** True when {@code (row, col)} lies on the board. */
    public static boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /**
     * Returns the color occupying a cell, or {@code null} when it is empty or off the board.
     */
    public PlayerColor get(int row, int col) {
        if (!inBounds(row, col)) {
            return null;
        }
        byte value = cells[row * SIZE + col];
        return value == EMPTY ? null : COLORS[value];
    }

    /** True when the cell is on the board and unclaimed. */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && cells[row * SIZE + col] == EMPTY;
    }

    /** True when the cell is on the board and claimed by {@code color}. */
    public boolean isColor(int row, int col, PlayerColor color) {
        return inBounds(row, col) && cells[row * SIZE + col] == color.id();
    }

    /**
     * Returns a new board with the filled cells of {@code shape}, offset by the anchor, claimed by
     * {@code color}. Cells that fall off the board are ignored; legality is the caller's concern.
     */
    public Board place(Shape shape, int row, int col, PlayerColor color) {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(color, "color");
        byte[] next = cells.clone();
        for (Cell cell : shape.cells()) {
            int r = row + cell.row();
            int c = col + cell.col();
            if (inBounds(r, c)) {
                next[r * SIZE + c] = (byte) color.id();
            }
        }
        return new Board(next);
    }

    /** Returns a new board with {@code move} committed for {@code color}. */
    public Board place(Move move, PlayerColor color) {
        return place(move.shape(), move.row(), move.col(), color);
    }

    /**
     * Returns a new board with a single cell set. Used to seed positions in tools and tests.
     *
     * @param color the new occupant, or {@code null} to clear the cell
     */
    public Board with(int row, int col, PlayerColor color) {
        if (!inBounds(row, col)) {
            throw new IllegalArgumentException("Cell off the board: (" + row + "," + col + ")");
        }
        byte[] next = cells.clone();
        next[row * SIZE + col] = color == null ? EMPTY : (byte) color.id();
        return new Board(next);
    }

    /** Number of cells claimed by {@code color}. */
    public int count(PlayerColor color) {
        int count = 0;
        for (byte value : cells) {
            if (value == color.id()) {
                count++;
            }
        }
        return count;
    }

    /** Number of claimed cells of any color. */
    public int occupiedCount() {
        int count = 0;
        for (byte value : cells) {
            if (value != EMPTY) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        return Arrays.equals(cells, ((Board) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }
}
