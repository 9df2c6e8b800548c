package ai.blokus.game;

/**
 * A board coordinate. Row grows downwards, column grows to the right.
 */
public record Cell(int row, int col) {

    public Cell offset(int dRow, int dCol) {
        return new Cell(row + dRow, col + dCol);
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
