package ai.blokus;

import ai.blokus.game.GameState;
import ai.blokus.game.Move;
import ai.blokus.game.PlayerColor;
import ai.blokus.player.ai.Tier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one structured JSON line per committed placement.
 *
 * <p>Lines go through this class's logger (routed to {@code moves.log} by the logging config) and
 * are prefixed with {@code MOVE_STEP } so they can be filtered out of mixed logs. Enable with
 * {@code -Dlog.moves=true}.
 */
public class MoveLogger {
    private static final Logger log = LoggerFactory.getLogger(MoveLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.moves");

    /**
     * Return true if move logging is enabled via -Dlog.moves=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Log one placement and the position it produced.
     *
     * @param step      1-based placement counter
     * @param color     color that placed
     * @param party     party that controlled the color for this placement
     * @param tier      tier of the computer player that chose the move
     * @param move      the committed move
     * @param after     snapshot after the placement and turn advance
     */
    public static void logPlacement(int step, PlayerColor color, int party, Tier tier, Move move, GameState after) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("type", "placement");
        line.put("step", step);
        line.put("color", color.displayName());
        line.put("party", party);
        line.put("tier", tier == null ? null : tier.name().toLowerCase());
        line.put("piece", move.piece().name());
        line.put("rotation", move.transformation().rotation());
        line.put("mirrored", move.transformation().mirrored());
        line.put("row", move.row());
        line.put("col", move.col());
        line.put("cells", move.cellCount());
        line.put("color_score", after.usedPieces().cellCount(color));
        line.put("total_placed", after.usedPieces().totalPlaced());
        line.put("next_color", after.turn().current().displayName());
        line.put("out", after.turn().out().stream().map(PlayerColor::displayName).toList());
        line.put("terminal", after.turn().terminal());
        try {
            if (log.isInfoEnabled()) {
                log.info("MOVE_STEP {}", OBJECT_MAPPER.writeValueAsString(line));
            }
        } catch (JsonProcessingException e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log move step {}", step, e);
            }
        }
    }
}
