package ai.blokus.config;

import ai.blokus.player.ai.Tier;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for computer players.
 *
 * Every party uses {@code ai.tier} unless {@code ai.parties.<index>} names another tier for it.
 *
 * Usage:
 * {@code java -jar blokus-engine.jar --ai.tier=advanced --ai.parties.1=novice}
 */
@Component
@ConfigurationProperties(prefix = "ai")
public class AiProperties {
  private Tier tier = Tier.BALANCED;
  private Map<Integer, Tier> parties = new HashMap<>();

  public Tier getTier() {
    return tier;
  }

  public void setTier(Tier tier) {
    this.tier = tier;
  }

  public Map<Integer, Tier> getParties() {
    return parties;
  }

  public void setParties(Map<Integer, Tier> parties) {
    this.parties = parties;
  }

  /**
   * Tier for a 0-based party index.
   * @param party party index
   * @return the override for that party, or the default tier
   */
  public Tier tierFor(int party) {
    return parties.getOrDefault(party, tier);
  }
}
