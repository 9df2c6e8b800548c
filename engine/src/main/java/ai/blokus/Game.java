package ai.blokus;

import ai.blokus.config.AiProperties;
import ai.blokus.config.GameProperties;
import ai.blokus.game.GameSession;
import ai.blokus.game.GameState;
import ai.blokus.game.Move;
import ai.blokus.game.PlacementResult;
import ai.blokus.game.PlayerColor;
import ai.blokus.game.PlayerMode;
import ai.blokus.game.Scoring;
import ai.blokus.game.Standing;
import ai.blokus.player.ai.AIController;
import ai.blokus.player.ai.HeuristicPlayer;
import ai.blokus.player.ai.MoveEvaluator;
import ai.blokus.player.ai.Tier;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private final GameProperties gameProperties;
    private final AiProperties aiProperties;

    public Game(GameProperties gameProperties, AiProperties aiProperties) {
        this.gameProperties = gameProperties;
        this.aiProperties = aiProperties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        GameResult result = play();
        System.out.println(result.finalState().board());
        System.out.println(result.completed() ? "Game over." : "Game stopped before completion.");
        for (Standing standing : result.standings()) {
            System.out.printf("%-10s %-22s %3d%n",
                    standing.name(), standing.colors(), standing.score());
        }
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Every party is a {@link HeuristicPlayer} at its configured tier, all sharing one seeded
     * random source. Each iteration asks the party controlling the active color for a move, commits
     * it (or passes when the player has none) and lets the session advance the turn, until the
     * session reports the game over or the iteration cap is hit.
     */
    public GameResult play() {
        PlayerMode mode = PlayerMode.forPartyCount(gameProperties.getPlayers());
        long seed = gameProperties.getSeed() != null ? gameProperties.getSeed() : new Random().nextLong();
        log.info("Starting {} game with seed {}", mode, seed);

        AIController controller = new AIController(mode, new MoveEvaluator(new Random(seed)));
        List<HeuristicPlayer> players = new ArrayList<>();
        for (int party = 0; party < mode.partyCount(); party++) {
            Tier tier = aiProperties.tierFor(party);
            players.add(new HeuristicPlayer(controller, tier));
            if (log.isDebugEnabled()) {
                log.debug("Party {} plays {} at {}", party, mode.colorsOf(party), tier);
            }
        }

        GameSession session = new GameSession(mode);
        int placements = 0;
        int passes = 0;
        int iterations = 0;
        final int maxIterations = gameProperties.getMaxIterations();

        while (!session.isOver()) {
            iterations++;
            if (iterations > maxIterations) {
                log.warn("Max iterations ({}) reached, stopping game loop.", maxIterations);
                break;
            }
            PlayerColor color = session.currentColor();
            int party = session.controllingParty();
            HeuristicPlayer player = players.get(party);

            Move move = player.nextMove(session);
            if (move == null) {
                session.pass();
                passes++;
                continue;
            }

            PlacementResult result = session.place(move);
            if (!result.isValid()) {
                log.warn("{} proposed illegal move {} for {} ({}); passing",
                        player, move, color, result.getReason().description());
                session.pass();
                passes++;
                continue;
            }
            placements++;

            if (MoveLogger.isEnabled()) {
                MoveLogger.logPlacement(placements, color, party, player.getTier(), move, session.getState());
            }
            if (log.isDebugEnabled()) {
                log.debug("{} (party {}) placed {}\n{}", color, party, move, session.getState().board());
            }
            if (!session.lastSkipped().isEmpty()) {
                log.info("Out of moves: {}", session.lastSkipped());
            }
        }

        GameState finalState = session.getState();
        List<Standing> standings = Scoring.standings(mode, finalState.usedPieces());
        log.info("Game finished after {} placements and {} passes; standings {}", placements, passes, standings);
        return new GameResult(mode, seed, standings, placements, passes, session.isOver(), finalState);
    }

    /**
     * Summary of a finished (or capped) game.
     *
     * @param mode        party topology played
     * @param seed        seed of the AI random source
     * @param standings   final score table
     * @param placements  committed placements
     * @param passes      passes taken
     * @param completed   true when the game reached its terminal state
     * @param finalState  last snapshot
     */
    public record GameResult(
            PlayerMode mode,
            long seed,
            List<Standing> standings,
            int placements,
            int passes,
            boolean completed,
            GameState finalState) {
    }
}
