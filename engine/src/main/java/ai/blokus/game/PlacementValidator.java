package ai.blokus.game;

import ai.blokus.game.PlacementResult.InvalidReason;
import java.util.Objects;

/**
 * Decides whether a single placement is legal.
 * <p>
 * Rules are checked in a fixed order and the first failure is reported:
 * <ol>
 *   <li><b>Bounds:</b> every filled cell lands on the board.</li>
 *   <li><b>Overlap:</b> no filled cell lands on a claimed cell.</li>
 *   <li><b>Corner contact:</b> on a color's first move a filled cell covers its starting corner;
 *       afterwards some filled cell has a same-color cell diagonally next to it.</li>
 *   <li><b>Edge exclusion:</b> (not on the first move) no filled cell has a same-color cell
 *       orthogonally next to it.</li>
 * </ol>
 * The validator is pure: it reads the board and shape and never modifies either.
 */
public final class PlacementValidator {
    static final int[][] DIAGONALS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    static final int[][] ORTHOGONALS = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    private PlacementValidator() {
    }

    public static PlacementResult validate(Board board, Move move, PlayerColor color, boolean isFirstMove) {
        return validate(board, move.row(), move.col(), move.shape(), color, isFirstMove);
    }

    /**
     * Check one placement.
     *
     * @param board       current board
     * @param row         anchor row (top of the shape's bounding box; may be negative)
     * @param col         anchor column (left of the shape's bounding box; may be negative)
     * @param shape       oriented shape
     * @param color       the color placing the piece
     * @param isFirstMove whether {@code color} has not placed anything yet
     * @return {@link PlacementResult#valid()} or the first rule that failed
     */
    public static PlacementResult validate(
            Board board, int row, int col, Shape shape, PlayerColor color, boolean isFirstMove) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(color, "color");

        if (!isWithinBounds(row, col, shape)) {
            return PlacementResult.invalid(InvalidReason.OUT_OF_BOUNDS);
        }
        if (hasOverlap(board, row, col, shape)) {
            return PlacementResult.invalid(InvalidReason.OVERLAP);
        }
        if (!touchesCorner(board, row, col, shape, color, isFirstMove)) {
            return PlacementResult.invalid(InvalidReason.MISSING_CORNER_TOUCH);
        }
        if (!isFirstMove && touchesEdge(board, row, col, shape, color)) {
            return PlacementResult.invalid(InvalidReason.EDGE_ADJACENCY);
        }
        return PlacementResult.valid();
    }

    static boolean isWithinBounds(int row, int col, Shape shape) {
        for (Cell cell : shape.cells()) {
            if (!Board.inBounds(row + cell.row(), col + cell.col())) {
                return false;
            }
        }
        return true;
    }

    static boolean hasOverlap(Board board, int row, int col, Shape shape) {
        for (Cell cell : shape.cells()) {
            if (!board.isEmpty(row + cell.row(), col + cell.col())) {
                return true;
            }
        }
        return false;
    }

    static boolean touchesCorner(Board board, int row, int col, Shape shape, PlayerColor color, boolean isFirstMove) {
        if (isFirstMove) {
            Cell corner = color.startingCorner();
            for (Cell cell : shape.cells()) {
                if (row + cell.row() == corner.row() && col + cell.col() == corner.col()) {
                    return true;
                }
            }
            return false;
        }
        return hasNeighbour(board, row, col, shape, color, DIAGONALS);
    }

    static boolean touchesEdge(Board board, int row, int col, Shape shape, PlayerColor color) {
        return hasNeighbour(board, row, col, shape, color, ORTHOGONALS);
    }

    private static boolean hasNeighbour(
            Board board, int row, int col, Shape shape, PlayerColor color, int[][] directions) {
        for (Cell cell : shape.cells()) {
            int r = row + cell.row();
            int c = col + cell.col();
            for (int[] d : directions) {
                if (board.isColor(r + d[0], c + d[1], color)) {
                    return true;
                }
            }
        }
        return false;
    }
}
