package ai.blokus.player.ai;

import ai.blokus.game.GameSession;
import ai.blokus.game.Move;
import ai.blokus.player.Player;
import java.util.Objects;

/**
 * Computer player that delegates every decision to an {@link AIController} at a fixed tier.
 */
public class HeuristicPlayer implements Player {
    private final AIController controller;
    private final Tier tier;

    public HeuristicPlayer(AIController controller, Tier tier) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.tier = Objects.requireNonNull(tier, "tier");
    }

    @Override
    public Move nextMove(GameSession session) {
        return controller.decideMove(session.getState(), session.currentColor(), tier);
    }

    public Tier getTier() {
        return tier;
    }

    @Override
    public String toString() {
        return "HeuristicPlayer(" + tier + ")";
    }
}
