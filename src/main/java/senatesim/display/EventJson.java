package senatesim.display;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import senatesim.events.DebateEvent;
import senatesim.events.Event;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;

/**
 * Flat JSON rendering of events, summaries and memory snapshots for log sinks.
 */
public final class EventJson {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private EventJson() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static ObjectNode toNode(Event event) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("id", event.id());
    node.put("type", event.type().name().toLowerCase());
    node.put("timestamp", event.timestamp().toString());
    node.put("source", event.sourceName());
    node.put("priority", event.priority());
    switch (event.type()) {
      case DEBATE -> {
        DebateEvent debate = (DebateEvent) event;
        node.put("debateEventType", debate.debateEventType().name().toLowerCase());
        node.put("topic", debate.topic());
        node.set("participants", MAPPER.valueToTree(debate.participants()));
      }
      case SPEECH -> {
        SpeechEvent speech = (SpeechEvent) event;
        node.put("topic", speech.topic());
        node.put("stance", speech.stance().label());
        node.put("content", speech.content());
        node.set("keyPoints", MAPPER.valueToTree(speech.keyPoints()));
      }
      case REACTION -> {
        ReactionEvent reaction = (ReactionEvent) event;
        node.put("targetEventId", reaction.targetEventId());
        node.put("reactionType", reaction.reactionType().label());
        node.put("content", reaction.content());
      }
      case INTERJECTION -> {
        InterjectionEvent interjection = (InterjectionEvent) event;
        node.put("targetSpeaker", interjection.targetSpeaker().name());
        node.put("targetSpeechId", interjection.targetSpeechId());
        node.put("interjectionType", interjection.interjectionType().label());
        node.put("causesDisruption", interjection.causesDisruption());
        node.put("latin", interjection.latinContent());
        node.put("english", interjection.englishContent());
      }
    }
    return node;
  }

  public static String toJson(Event event) {
    return write(toNode(event));
  }

  /** Serializes plain value types such as summaries and memory snapshots. */
  public static String toJson(Object value) {
    return write(value);
  }

  private static String write(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render JSON for " + value.getClass().getSimpleName(), e);
    }
  }
}
