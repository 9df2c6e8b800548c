package ai.blokus.game;

/**
 * Plain-text dump of a {@link Board} for console output and debug logs.
 * <p>
 * Empty cells print as {@code .}, claimed cells as the color's {@link PlayerColor#symbol()}.
 * Column indices run along the top and row indices down the left.
 */
public class BoardFormatter {
    private final Board board;

    public BoardFormatter(Board board) {
        this.board = board;
    }

    public String format() {
        StringBuilder sb = new StringBuilder((Board.SIZE + 1) * (Board.SIZE * 2 + 4));
        sb.append("   ");
        for (int col = 0; col < Board.SIZE; col++) {
            sb.append(col % 10).append(' ');
        }
        sb.append('\n');
        for (int row = 0; row < Board.SIZE; row++) {
            sb.append(String.format("%2d ", row));
            for (int col = 0; col < Board.SIZE; col++) {
                PlayerColor color = board.get(row, col);
                sb.append(color == null ? '.' : color.symbol()).append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
