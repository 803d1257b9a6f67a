package senatesim.display;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.DebateEvent;
import senatesim.events.SpeechEvent;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventJsonTest {

  private final Senator cato = new Senator("cato", "Cato", "Optimates", 4);

  @Test
  void speech_rendersFlatFields() throws Exception {
    SpeechEvent speech = new SpeechEvent(cato, "Land Reform", "Carthago delenda est.", Stance.OPPOSE,
        List.of("Tradition"));

    JsonNode node = EventJson.mapper().readTree(EventJson.toJson(speech));

    assertThat(node.get("id").asText()).isEqualTo(speech.id());
    assertThat(node.get("type").asText()).isEqualTo("speech");
    assertThat(node.get("source").asText()).isEqualTo("Cato");
    assertThat(node.get("priority").asInt()).isEqualTo(4);
    assertThat(node.get("stance").asText()).isEqualTo("oppose");
    assertThat(node.get("keyPoints").get(0).asText()).isEqualTo("Tradition");
    assertThat(node.get("timestamp").asText()).isEqualTo(speech.timestamp().toString());
  }

  @Test
  void debateStart_listsParticipants() {
    DebateEvent start = DebateEvent.start("Land Reform", List.of("Cato", "Caesar"));

    JsonNode node = EventJson.toNode(start);

    assertThat(node.get("debateEventType").asText()).isEqualTo("debate_start");
    assertThat(node.get("participants").size()).isEqualTo(2);
  }

  @Test
  void plainValues_areSerialized() throws Exception {
    String json = EventJson.toJson(new LoggingDebateListener.SpeechFailure("Cato", "Land Reform", "timed out"));

    JsonNode node = EventJson.mapper().readTree(json);
    assertThat(node.get("speaker").asText()).isEqualTo("Cato");
    assertThat(node.get("error").asText()).isEqualTo("timed out");
  }
}
