package senatesim.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.agents.DecisionModel;
import senatesim.agents.SenatorAgent;
import senatesim.debate.DebateListener;
import senatesim.debate.DebateManager;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.EventBus;
import senatesim.memory.AgentMemory;
import senatesim.memory.MemorySnapshot;
import senatesim.speech.SpeechGenerator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * One senate wired for debate: a shared bus and one subscribed agent per roster entry.
 * Agent {@code i} draws from {@code new Random(seed + i)}, so a run replays under a fixed seed.
 */
public class SenateRegistry {
  private static final Logger log = LoggerFactory.getLogger(SenateRegistry.class);

  private final SimulationConfig config;
  private final EventBus bus;
  private final Map<String, SenatorAgent> agentsById;
  private final Map<String, String> idByNormalizedName;

  private SenateRegistry(SimulationConfig config, EventBus bus, Map<String, SenatorAgent> agentsById) {
    this.config = config;
    this.bus = bus;
    this.agentsById = agentsById;
    this.idByNormalizedName = buildNameIndex(agentsById);
  }

  public static SenateRegistry build(SimulationConfig config, List<SenatorLoader.SenatorConfig> roster,
                                     DebateListener listener) {
    if (config == null) throw new IllegalArgumentException("config must not be null");
    if (roster == null || roster.isEmpty()) throw new IllegalArgumentException("roster must not be empty");

    EventBus bus = new EventBus(config.maxHistory());
    DecisionModel model = new DecisionModel(config.weights());
    Map<String, Stance> declared = new HashMap<>();
    for (SenatorLoader.SenatorConfig entry : roster) {
      Stance stance = entry.initialStance();
      if (stance != null) declared.put(entry.id.trim(), stance);
    }

    Map<String, SenatorAgent> agents = new LinkedHashMap<>();
    for (int i = 0; i < roster.size(); i++) {
      SenatorLoader.SenatorConfig entry = roster.get(i);
      Senator senator = entry.toSenator();
      AgentMemory memory = new AgentMemory(senator.name());
      SenatorAgent agent = new SenatorAgent(senator, memory, bus, new Random(config.seed() + i), model,
          (s, topic) -> declared.getOrDefault(s.id(), Stance.NEUTRAL));
      agent.setListener(listener);
      agent.subscribe();
      agents.put(senator.id(), agent);
    }
    SenateRegistry registry = new SenateRegistry(config, bus, agents);
    for (SenatorLoader.SenatorConfig entry : roster) {
      registry.seedRelationships(registry.agentById(entry.id.trim()), entry.relationships);
    }
    log.info("[Senate] Seated {} senators", agents.size());
    return registry;
  }

  /**
   * Roster relationships may name a colleague by full or last name; scores are stored under
   * the full name so they match the speaker names seen during debate.
   */
  private void seedRelationships(SenatorAgent agent, Map<String, Double> relationships) {
    if (relationships == null) return;
    relationships.forEach((other, score) -> {
      if (other == null || score == null) return;
      SenatorAgent resolved = agentByNameApprox(other);
      String key = other.trim();
      if (resolved == null) {
        log.warn("[Senate] {} lists a relationship with unknown senator {}", agent.name(), other);
      } else {
        key = resolved.name();
      }
      agent.memory().recordRelationshipImpact(key, null, score, "Initial relationship");
    });
  }

  public EventBus bus() { return bus; }

  public List<SenatorAgent> agents() { return List.copyOf(agentsById.values()); }

  /** Senators in roster order. */
  public List<Senator> senators() {
    List<Senator> out = new ArrayList<>();
    for (SenatorAgent agent : agentsById.values()) out.add(agent.senator());
    return out;
  }

  public SenatorAgent agentById(String id) { return agentsById.get(id); }

  /** Current stance of {@code senator} on {@code topic}, or null if it holds none yet. */
  public Stance stanceOf(Senator senator, String topic) {
    if (senator == null) return null;
    SenatorAgent agent = agentsById.get(senator.id());
    return agent == null ? null : agent.stanceOn(topic);
  }

  public DebateManager newDebateManager(SpeechGenerator generator, DebateListener listener) {
    DebateManager manager = new DebateManager(bus, generator, listener, config.speechPause());
    manager.setStanceHints(this::stanceOf);
    return manager;
  }

  public Map<String, MemorySnapshot> memorySnapshots() {
    Map<String, MemorySnapshot> out = new LinkedHashMap<>();
    for (SenatorAgent agent : agentsById.values()) {
      out.put(agent.name(), agent.memory().snapshot());
    }
    return out;
  }

  public SenatorAgent agentByNameApprox(String name) {
    if (name == null) return null;
    String normalized = normalizeName(name);
    String exact = idByNormalizedName.get(normalized);
    if (exact != null) return agentsById.get(exact);

    // Try last-name match.
    String[] parts = normalized.split("\\s+");
    String last = parts.length == 0 ? normalized : parts[parts.length - 1];
    if (!last.isBlank()) {
      for (var entry : idByNormalizedName.entrySet()) {
        String key = entry.getKey();
        if (key.endsWith(" " + last) || key.equals(last)) {
          return agentsById.get(entry.getValue());
        }
      }
    }
    return null;
  }

  private static Map<String, String> buildNameIndex(Map<String, SenatorAgent> agents) {
    Map<String, String> index = new HashMap<>();
    for (var entry : agents.entrySet()) {
      index.put(normalizeName(entry.getValue().name()), entry.getKey());
    }
    return index;
  }

  private static String normalizeName(String name) {
    return name == null ? "" : name.toLowerCase().trim().replaceAll("\\s+", " ");
  }
}
