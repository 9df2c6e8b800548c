package ai.blokus.unit.helpers;

import ai.blokus.game.Board;
import ai.blokus.game.Move;
import ai.blokus.game.Piece;
import ai.blokus.game.PlayerColor;

/**
 * Fluent builder for seeding boards in tests.
 *
 * <pre>{@code
 * Board board = BoardBuilder.emptyBoard()
 *     .rows(0,
 *         "BB..",
 *         "..R.")
 *     .place(Piece.L3, 5, 5, PlayerColor.GREEN)
 *     .build();
 * }</pre>
 *
 * Row strings use {@code .} for empty cells and the color symbols {@code B R G Y}; they start at
 * column 0 and may be shorter than the board.
 */
public final class BoardBuilder {
    private Board board;

    private BoardBuilder(Board board) {
        this.board = board;
    }

    public static BoardBuilder emptyBoard() {
        return new BoardBuilder(Board.empty());
    }

    /** Every cell claimed by {@code color}. */
    public static BoardBuilder filledWith(PlayerColor color) {
        BoardBuilder builder = emptyBoard();
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                builder.board = builder.board.with(row, col, color);
            }
        }
        return builder;
    }

    public BoardBuilder rows(int topRow, String... rows) {
        for (int r = 0; r < rows.length; r++) {
            String line = rows[r];
            for (int c = 0; c < line.length(); c++) {
                board = board.with(topRow + r, c, colorOf(line.charAt(c)));
            }
        }
        return this;
    }

    /** Set one cell; {@code null} clears it. */
    public BoardBuilder cell(int row, int col, PlayerColor color) {
        board = board.with(row, col, color);
        return this;
    }

    /** Stamp a piece's canonical orientation with its bounding box at {@code (row, col)}. No rule checks. */
    public BoardBuilder place(Piece piece, int row, int col, PlayerColor color) {
        board = board.place(piece.shape(), row, col, color);
        return this;
    }

    public Board build() {
        return board;
    }

    /** A move using the piece's canonical orientation. */
    public static Move move(Piece piece, int row, int col) {
        return new Move(piece, piece.transformations().get(0), row, col);
    }

    private static PlayerColor colorOf(char symbol) {
        if (symbol == '.') {
            return null;
        }
        for (PlayerColor color : PlayerColor.values()) {
            if (color.symbol() == symbol) {
                return color;
            }
        }
        throw new IllegalArgumentException("Unknown board symbol: " + symbol);
    }
}
