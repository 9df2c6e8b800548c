package ai.blokus.game;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turn controller for one game: owns the live {@link GameState} and the undo history.
 * <p>
 * Before each committed placement the current snapshot is pushed onto the history; {@link #undo()}
 * pops it back. Snapshots are immutable, so the history never aliases mutable state. Passing does
 * not create a history entry.
 */
public class GameSession {
    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    private final PlayerMode mode;
    private final TurnResolver turnResolver;
    private final Deque<GameState> history = new ArrayDeque<>();
    private GameState state;
    private List<PlayerColor> lastSkipped = Collections.emptyList();

    public GameSession(PlayerMode mode) {
        this(mode, GameState.initial());
    }

    /**
     * Start a session from an arbitrary snapshot (used by tools and tests to resume positions).
     */
    public GameSession(PlayerMode mode, GameState initialState) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.turnResolver = new TurnResolver(mode);
        this.state = Objects.requireNonNull(initialState, "initialState");
    }

    public PlayerMode getMode() {
        return mode;
    }

    public GameState getState() {
        return state;
    }

    public PlayerColor currentColor() {
        return state.turn().current();
    }

    /** The party that plays the active color, accounting for who holds the neutral color. */
    public int controllingParty() {
        return mode.controllingParty(currentColor(), state.turn().neutralHolder());
    }

    /** Allies and opponents of the active color. */
    public Alliance alliance() {
        return mode.alliance(currentColor(), state.turn().neutralHolder());
    }

    public boolean isOver() {
        return state.turn().terminal();
    }

    /** Colors newly marked out by the most recent turn advance. */
    public List<PlayerColor> lastSkipped() {
        return lastSkipped;
    }

    public boolean canUndo() {
        return !history.isEmpty();
    }

    public int historySize() {
        return history.size();
    }

    /**
     * Attempt to place {@code move} for the active color.
     * <p>
     * An illegal placement leaves the session untouched and returns the failed rule. A legal one is
     * committed, the previous snapshot is kept for undo and the turn moves on.
     *
     * @throws IllegalStateException if the game is over or the active color already placed that piece
     */
    public PlacementResult place(Move move) {
        Objects.requireNonNull(move, "move");
        if (isOver()) {
            throw new IllegalStateException("Game is over; no further placements");
        }
        PlayerColor color = currentColor();
        if (state.usedPieces().contains(color, move.piece())) {
            throw new IllegalStateException(color.displayName() + " already placed " + move.piece());
        }
        PlacementResult result = PlacementValidator.validate(state.board(), move, color, state.isFirstMove(color));
        if (!result.isValid()) {
            if (log.isDebugEnabled()) {
                log.debug("Rejected {} for {}: {}", move, color, result.getReason());
            }
            return result;
        }

        history.push(state);
        GameState placed = state.afterPlacement(move, color);
        state = placed.withTurn(advanceFrom(color, placed).toTurnState());
        return result;
    }

    /**
     * Hand the turn on without placing.
     *
     * @return the advance that was applied
     */
    public TurnAdvance pass() {
        if (isOver()) {
            throw new IllegalStateException("Game is over; nothing to pass");
        }
        TurnAdvance advance = advanceFrom(currentColor(), state);
        state = state.withTurn(advance.toTurnState());
        return advance;
    }

    /**
     * Revert to the snapshot taken before the last placement.
     *
     * @return false when there is nothing to undo
     */
    public boolean undo() {
        if (history.isEmpty()) {
            return false;
        }
        state = history.pop();
        lastSkipped = Collections.emptyList();
        return true;
    }

    private TurnAdvance advanceFrom(PlayerColor color, GameState snapshot) {
        TurnState turn = snapshot.turn();
        TurnAdvance advance = turnResolver.advance(
                color,
                snapshot.board(),
                snapshot.usedPieces(),
                snapshot.pendingFirstMoves(),
                turn.out(),
                turn.neutralHolder());
        lastSkipped = advance.skipped();
        return advance;
    }
}
