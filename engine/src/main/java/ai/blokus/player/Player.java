package ai.blokus.player;

import ai.blokus.game.GameSession;
import ai.blokus.game.Move;

/**
 * Something that can choose the next placement for the active color of a session.
 */
public interface Player {

    /**
     * Choose a placement for {@code session.currentColor()}.
     *
     * @param session live session; implementations must not mutate it
     * @return the move to place, or {@code null} to pass
     */
    Move nextMove(GameSession session);
}
