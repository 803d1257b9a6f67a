package senatesim.config;

import senatesim.agents.DecisionWeights;
import senatesim.events.EventBus;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Run settings. Values come from {@code senate.properties} in the working directory, overridden
 * by {@code SENATE_*} environment variables ({@code roster.path} becomes {@code SENATE_ROSTER_PATH}).
 */
public class SimulationConfig {
  public static final String DEFAULT_FILE = "senate.properties";

  private final String rosterPath;
  private final String topic;
  private final long seed;
  private final int maxHistory;
  private final Duration generationTimeout;
  private final Duration speechPause;
  private final DecisionWeights weights;

  public SimulationConfig(String rosterPath, String topic, long seed, int maxHistory,
                          Duration generationTimeout, Duration speechPause, DecisionWeights weights) {
    this.rosterPath = rosterPath;
    this.topic = topic;
    this.seed = seed;
    this.maxHistory = maxHistory;
    this.generationTimeout = generationTimeout;
    this.speechPause = speechPause;
    this.weights = weights;
  }

  public static SimulationConfig defaults() {
    return new SimulationConfig("", "Land Reform", 42L, EventBus.DEFAULT_MAX_HISTORY,
        Duration.ofSeconds(10), Duration.ZERO, DecisionWeights.defaults());
  }

  /** Blank when the bundled roster should be used. */
  public String rosterPath() { return rosterPath; }
  public String topic() { return topic; }
  public long seed() { return seed; }
  public int maxHistory() { return maxHistory; }
  public Duration generationTimeout() { return generationTimeout; }
  public Duration speechPause() { return speechPause; }
  public DecisionWeights weights() { return weights; }

  public static SimulationConfig load() throws IOException {
    return load(Path.of(DEFAULT_FILE));
  }

  public static SimulationConfig load(Path path) throws IOException {
    Properties props = new Properties();
    if (Files.exists(path)) {
      try (InputStream in = Files.newInputStream(path)) {
        props.load(in);
      }
    }
    return fromProperties(props, System::getenv);
  }

  public static SimulationConfig fromProperties(Properties props, Function<String, String> env) {
    Source source = new Source(props, env);
    DecisionWeights d = DecisionWeights.defaults();

    String rosterPath = source.string("roster.path", "");
    String topic = source.string("debate.topic", "Land Reform");
    long seed = source.longValue("random.seed", 42L);
    int maxHistory = source.intValue("bus.max_history", EventBus.DEFAULT_MAX_HISTORY);
    if (maxHistory < 1) {
      throw new IllegalStateException("bus.max_history must be at least 1: " + maxHistory);
    }
    Duration timeout = Duration.ofMillis(source.longValue("speech.timeout_ms", 10_000L));
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException("speech.timeout_ms must be positive: " + timeout.toMillis());
    }
    Duration pause = Duration.ofMillis(Math.max(0L, source.longValue("speech.pause_ms", 0L)));

    DecisionWeights weights;
    try {
      weights = new DecisionWeights(
          source.doubleValue("decision.reaction.base", d.reactionBase()),
          source.doubleValue("decision.reaction.cap", d.reactionCap()),
          source.doubleValue("decision.reaction.relationship_weight", d.reactionRelationshipWeight()),
          source.doubleValue("decision.reaction.faction_bonus", d.reactionFactionBonus()),
          source.doubleValue("decision.reaction.max_topic_interest", d.maxTopicInterest()),
          source.doubleValue("decision.interjection.base", d.interjectionBase()),
          source.doubleValue("decision.interjection.cap", d.interjectionCap()),
          source.doubleValue("decision.interjection.relationship_weight", d.interjectionRelationshipWeight()),
          source.doubleValue("decision.interjection.rank_step", d.interjectionRankStep()),
          source.doubleValue("decision.interjection.rank_cap", d.interjectionRankCap()),
          source.doubleValue("decision.interjection.stance_bonus", d.interjectionStanceBonus()),
          source.doubleValue("decision.stance_change.base", d.stanceChangeBase()),
          source.doubleValue("decision.stance_change.cap", d.stanceChangeCap()),
          source.doubleValue("decision.stance_change.relationship_weight", d.stanceChangeRelationshipWeight()),
          source.doubleValue("decision.stance_change.faction_bonus", d.stanceChangeFactionBonus()),
          source.doubleValue("decision.stance_change.rank_step", d.stanceChangeRankStep()),
          source.doubleValue("decision.stance_change.rank_cap", d.stanceChangeRankCap()),
          source.doubleValue("decision.strong_relationship", d.strongRelationship()));
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid decision weights: " + e.getMessage(), e);
    }
    return new SimulationConfig(rosterPath, topic, seed, maxHistory, timeout, pause, weights);
  }

  static String envKey(String key) {
    return "SENATE_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
  }

  private static final class Source {
    private final Properties props;
    private final Function<String, String> env;

    private Source(Properties props, Function<String, String> env) {
      this.props = props == null ? new Properties() : props;
      this.env = env == null ? k -> null : env;
    }

    String string(String key, String defaultValue) {
      String fromEnv = env.apply(envKey(key));
      if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
      String value = props.getProperty(key);
      if (value != null && !value.isBlank()) return value.trim();
      return defaultValue;
    }

    int intValue(String key, int defaultValue) {
      String raw = string(key, null);
      if (raw == null) return defaultValue;
      try {
        return Integer.parseInt(raw);
      } catch (NumberFormatException e) {
        throw new IllegalStateException("Invalid integer for " + key + ": " + raw, e);
      }
    }

    long longValue(String key, long defaultValue) {
      String raw = string(key, null);
      if (raw == null) return defaultValue;
      try {
        return Long.parseLong(raw);
      } catch (NumberFormatException e) {
        throw new IllegalStateException("Invalid number for " + key + ": " + raw, e);
      }
    }

    double doubleValue(String key, double defaultValue) {
      String raw = string(key, null);
      if (raw == null) return defaultValue;
      try {
        return Double.parseDouble(raw);
      } catch (NumberFormatException e) {
        throw new IllegalStateException("Invalid decimal for " + key + ": " + raw, e);
      }
    }
  }
}
