package senatesim.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationConfigTest {

  @Test
  void emptySources_yieldDefaults() {
    SimulationConfig config = SimulationConfig.fromProperties(new Properties(), k -> null);
    SimulationConfig defaults = SimulationConfig.defaults();

    assertThat(config.topic()).isEqualTo("Land Reform").isEqualTo(defaults.topic());
    assertThat(config.seed()).isEqualTo(42L);
    assertThat(config.maxHistory()).isEqualTo(100);
    assertThat(config.generationTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.speechPause()).isEqualTo(Duration.ZERO);
    assertThat(config.rosterPath()).isEmpty();
    assertThat(config.weights()).isEqualTo(defaults.weights());
  }

  @Test
  void environment_overridesProperties() {
    Properties props = new Properties();
    props.setProperty("debate.topic", "Grain Dole");
    props.setProperty("random.seed", "7");
    props.setProperty("decision.reaction.base", "0.4");
    Map<String, String> env = Map.of("SENATE_DEBATE_TOPIC", "Carthage", "SENATE_BUS_MAX_HISTORY", "12");

    SimulationConfig config = SimulationConfig.fromProperties(props, env::get);

    assertThat(config.topic()).isEqualTo("Carthage");
    assertThat(config.seed()).isEqualTo(7L);
    assertThat(config.maxHistory()).isEqualTo(12);
    assertThat(config.weights().reactionBase()).isEqualTo(0.4);
  }

  @Test
  void envKey_upperCasesAndReplacesDots() {
    assertThat(SimulationConfig.envKey("decision.stance_change.base")).isEqualTo("SENATE_DECISION_STANCE_CHANGE_BASE");
  }

  @Test
  void malformedValues_areRejected() {
    Properties badSeed = new Properties();
    badSeed.setProperty("random.seed", "forty-two");
    assertThatThrownBy(() -> SimulationConfig.fromProperties(badSeed, k -> null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("random.seed");

    Properties badCap = new Properties();
    badCap.setProperty("decision.interjection.cap", "1.5");
    assertThatThrownBy(() -> SimulationConfig.fromProperties(badCap, k -> null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("interjectionCap");

    Properties badHistory = new Properties();
    badHistory.setProperty("bus.max_history", "0");
    assertThatThrownBy(() -> SimulationConfig.fromProperties(badHistory, k -> null))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void load_readsPropertiesFile(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("senate.properties");
    Files.writeString(file, "speech.pause_ms=250\nspeech.timeout_ms=500\n");

    SimulationConfig config = SimulationConfig.load(file);

    assertThat(config.speechPause()).isEqualTo(Duration.ofMillis(250));
    assertThat(config.generationTimeout()).isEqualTo(Duration.ofMillis(500));
  }
}
