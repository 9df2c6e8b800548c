package ai.blokus.player.ai;

import ai.blokus.game.Board;
import ai.blokus.game.Cell;
import ai.blokus.game.Move;
import ai.blokus.game.Piece;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.UsedPieces;
import java.util.Random;
import java.util.Set;

/**
 * Scoring primitives shared by the tier scorers.
 * <p>
 * Every function is pure. Functions that look at the position after a move take the simulated
 * board explicitly; callers build it with {@link Board#place(Move, PlayerColor)}, which returns a
 * copy, so the live board is never touched.
 */
public final class Heuristics {
    static final double CENTER = Board.SIZE / 2.0;

    private static final int[][] DIAGONALS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};
    private static final int RECENT_PIECES = 3;
    private static final int SYNERGY_RADIUS = 3;

    private Heuristics() {
    }

    /**
     * Euclidean distance from the centroid of the move's filled cells (cell centres at
     * {@code r + 0.5}, {@code c + 0.5}) to the board centre (10, 10).
     */
    public static double distanceToCenter(Move move) {
        double sumRow = 0;
        double sumCol = 0;
        int n = 0;
        for (Cell cell : move.cells()) {
            sumRow += cell.row() + 0.5;
            sumCol += cell.col() + 0.5;
            n++;
        }
        double dRow = sumRow / n - CENTER;
        double dCol = sumCol / n - CENTER;
        return Math.sqrt(dRow * dRow + dCol * dCol);
    }

    /** Bonus of {@code radius - distance}, floored at zero. */
    public static double centerBonus(Move move, double radius) {
        return Math.max(0, radius - distanceToCenter(move));
    }

    /** True when the move's bounding box comes within one cell of any board edge. */
    public static boolean nearBoardEdge(Move move) {
        return move.row() <= 1
                || move.col() <= 1
                || move.row() + move.height() >= Board.SIZE - 1
                || move.col() + move.width() >= Board.SIZE - 1;
    }

    /**
     * Diagonal neighbours of the move's cells (on the board after the move) that are empty or held
     * by an ally other than the mover. Counted per neighbour, so a cell reachable from two filled
     * cells counts twice.
     */
    public static int cornerConnections(Board after, Move move, PlayerColor color, Set<PlayerColor> allies) {
        int connections = 0;
        for (Cell cell : move.cells()) {
            for (int[] d : DIAGONALS) {
                int r = cell.row() + d[0];
                int c = cell.col() + d[1];
                if (!Board.inBounds(r, c)) {
                    continue;
                }
                PlayerColor occupant = after.get(r, c);
                if (occupant == null || (occupant != color && allies.contains(occupant))) {
                    connections++;
                }
            }
        }
        return connections;
    }

    /**
     * Distinct empty cells diagonally adjacent to any ally-held cell on the whole board.
     */
    public static int territory(Board board, Set<PlayerColor> allies) {
        boolean[] counted = new boolean[Board.CELL_COUNT];
        int territory = 0;
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                PlayerColor occupant = board.get(row, col);
                if (occupant == null || !allies.contains(occupant)) {
                    continue;
                }
                for (int[] d : DIAGONALS) {
                    int r = row + d[0];
                    int c = col + d[1];
                    if (board.isEmpty(r, c) && !counted[r * Board.SIZE + c]) {
                        counted[r * Board.SIZE + c] = true;
                        territory++;
                    }
                }
            }
        }
        return territory;
    }

    /**
     * For each cell newly claimed between {@code before} and {@code after}, two points per
     * opponent-held diagonal neighbour on {@code before}.
     */
    public static int blockingValue(Board before, Board after, Set<PlayerColor> opponents) {
        int value = 0;
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (!before.isEmpty(row, col) || after.isEmpty(row, col)) {
                    continue;
                }
                for (int[] d : DIAGONALS) {
                    PlayerColor occupant = before.get(row + d[0], col + d[1]);
                    if (occupant != null && opponents.contains(occupant)) {
                        value += 2;
                    }
                }
            }
        }
        return value;
    }

    /**
     * Diagonal neighbours of the move's cells held by any ally color (the mover included) on the
     * board after the move.
     */
    public static int connectivity(Board after, Move move, Set<PlayerColor> allies) {
        int connectivity = 0;
        for (Cell cell : move.cells()) {
            for (int[] d : DIAGONALS) {
                PlayerColor occupant = after.get(cell.row() + d[0], cell.col() + d[1]);
                if (occupant != null && allies.contains(occupant)) {
                    connectivity++;
                }
            }
        }
        return connectivity;
    }

    /**
     * Proximity between two ally colors: for every {@code color} cell, each {@code otherAlly} cell in
     * the surrounding 7×7 window adds {@code max(0, 4 - manhattanDistance)}.
     */
    public static int synergy(Board board, PlayerColor color, PlayerColor otherAlly) {
        int synergy = 0;
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                if (!board.isColor(row, col, color)) {
                    continue;
                }
                for (int dr = -SYNERGY_RADIUS; dr <= SYNERGY_RADIUS; dr++) {
                    for (int dc = -SYNERGY_RADIUS; dc <= SYNERGY_RADIUS; dc++) {
                        if (board.isColor(row + dr, col + dc, otherAlly)) {
                            synergy += Math.max(0, 4 - (Math.abs(dr) + Math.abs(dc)));
                        }
                    }
                }
            }
        }
        return synergy;
    }

    /**
     * Anti-mirroring bonus: minus five for each opponent whose last three placements include
     * {@code piece}, plus a color-scaled random term of up to {@code 8 * (id + 1)}.
     */
    public static double varietyBonus(
            Piece piece, PlayerColor color, UsedPieces usedPieces, Set<PlayerColor> opponents, Random random) {
        double bonus = 0;
        for (PlayerColor opponent : opponents) {
            if (usedPieces.recent(opponent, RECENT_PIECES).contains(piece)) {
                bonus -= 5;
            }
        }
        bonus += (color.id() + 1) * random.nextDouble() * 8;
        return bonus;
    }
}
