package ai.blokus.game;

/**
 * The four board-claiming colors, in turn order.
 * <p>
 * Each color owns one board corner; its first placement must cover that corner.
 */
public enum PlayerColor {
    BLUE(0, "Blue", 'B', new Cell(0, 0)),
    RED(1, "Red", 'R', new Cell(0, Board.SIZE - 1)),
    GREEN(2, "Green", 'G', new Cell(Board.SIZE - 1, Board.SIZE - 1)),
    YELLOW(3, "Yellow", 'Y', new Cell(Board.SIZE - 1, 0));

    private static final PlayerColor[] BY_ID = values();

    private final int id;
    private final String displayName;
    private final char symbol;
    private final Cell startingCorner;

    PlayerColor(int id, String displayName, char symbol, Cell startingCorner) {
        this.id = id;
        this.displayName = displayName;
        this.symbol = symbol;
        this.startingCorner = startingCorner;
    }

    public int id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    /** Single-letter symbol used in text board dumps. */
    public char symbol() {
        return symbol;
    }

    public Cell startingCorner() {
        return startingCorner;
    }

    /** The color that moves after this one in the fixed cyclic order. */
    public PlayerColor next() {
        return BY_ID[(id + 1) % BY_ID.length];
    }

    /**
     * Resolve a color from its numeric id.
     *
     * @throws IllegalArgumentException if the id is outside 0..3
     */
    public static PlayerColor fromId(int id) {
        if (id < 0 || id >= BY_ID.length) {
            throw new IllegalArgumentException("Unknown color id: " + id);
        }
        return BY_ID[id];
    }
}
