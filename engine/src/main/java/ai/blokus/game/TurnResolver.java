package ai.blokus.game;

import ai.blokus.player.LegalMovesHelper;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances the turn around the four colors, skipping any color that can no longer place.
 * <p>
 * Starting after the color that just moved or passed, each color not already out is probed with
 * {@link LegalMovesHelper#hasAnyValidMove}. The first one with a legal placement becomes active;
 * those without are marked out and stay out. When all four fail the game is terminal.
 * <p>
 * In {@link PlayerMode#THREE_PARTY} games the neutral holder pointer moves on by one party each time
 * the walk leaves the neutral color's slot, whether the neutral color was just played or is being
 * skipped.
 */
public final class TurnResolver {
    private static final Logger log = LoggerFactory.getLogger(TurnResolver.class);

    private final PlayerMode mode;

    public TurnResolver(PlayerMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public PlayerMode getMode() {
        return mode;
    }

    /**
     * Find the next color to move after {@code from}.
     *
     * @param from              the color that just placed or passed
     * @param board             board after that action
     * @param usedPieces        placements so far
     * @param pendingFirstMoves colors that have not placed yet
     * @param out               colors already out
     * @param neutralHolder     current neutral pointer
     */
    public TurnAdvance advance(
            PlayerColor from,
            Board board,
            UsedPieces usedPieces,
            Set<PlayerColor> pendingFirstMoves,
            Set<PlayerColor> out,
            int neutralHolder) {
        Objects.requireNonNull(from, "from");
        Set<PlayerColor> updatedOut = out.isEmpty() ? EnumSet.noneOf(PlayerColor.class) : EnumSet.copyOf(out);
        List<PlayerColor> skipped = new ArrayList<>();
        int holder = neutralHolder;

        if (mode.isNeutral(from)) {
            holder = nextHolder(holder);
        }

        PlayerColor candidate = from.next();
        for (int checked = 0; checked < PlayerColor.values().length; checked++) {
            if (!updatedOut.contains(candidate)) {
                boolean firstMove = pendingFirstMoves.contains(candidate);
                if (LegalMovesHelper.hasAnyValidMove(board, candidate, usedPieces, firstMove)) {
                    if (log.isDebugEnabled() && !skipped.isEmpty()) {
                        log.debug("Turn passes from {} to {}; out of moves: {}", from, candidate, skipped);
                    }
                    return new TurnAdvance(candidate, updatedOut, holder, false, skipped);
                }
                updatedOut.add(candidate);
                skipped.add(candidate);
            }
            if (mode.isNeutral(candidate)) {
                holder = nextHolder(holder);
            }
            candidate = candidate.next();
        }

        if (log.isDebugEnabled()) {
            log.debug("No color can move after {}; game over (newly out: {})", from, skipped);
        }
        return new TurnAdvance(from, updatedOut, holder, true, skipped);
    }

    private int nextHolder(int holder) {
        return (holder + 1) % mode.partyCount();
    }
}
