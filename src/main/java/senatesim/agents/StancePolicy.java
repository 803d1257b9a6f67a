package senatesim.agents;

import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.HashMap;
import java.util.Map;

/**
 * Chooses the stance a senator starts a debate with when it holds none for the topic.
 */
@FunctionalInterface
public interface StancePolicy {
  Stance initialStance(Senator senator, String topic);

  static StancePolicy neutral() {
    return (senator, topic) -> Stance.NEUTRAL;
  }

  static StancePolicy byFaction(Map<String, Stance> stanceByFaction, Stance fallback) {
    Map<String, Stance> normalized = new HashMap<>();
    if (stanceByFaction != null) {
      stanceByFaction.forEach((faction, stance) -> {
        if (faction != null && stance != null) normalized.put(faction.trim().toLowerCase(), stance);
      });
    }
    Stance otherwise = fallback == null ? Stance.NEUTRAL : fallback;
    return (senator, topic) -> normalized.getOrDefault(senator.faction().toLowerCase(), otherwise);
  }
}
