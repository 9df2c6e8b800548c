package ai.blokus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the headless game runner.
 *
 * Usage:
 * {@code java -jar blokus-engine.jar --game.players=2 --game.seed=42}
 */
@Component
@ConfigurationProperties(prefix = "game")
public class GameProperties {
  private int players = 4;
  private Long seed;
  private int maxIterations = 1000;

  /**
   * Number of controlling parties: 2, 3 or 4.
   * @return the party count
   */
  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Seed for the AI random source; when unset a seed is drawn and logged so the game can be replayed.
   * @return the configured seed, or null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Safety cap on turns (placements plus passes) before the runner gives up.
   * @return the iteration cap
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }
}
