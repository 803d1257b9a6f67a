package senatesim.events;

import senatesim.domain.DebateEventType;
import senatesim.domain.Senator;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class DebateEvent extends Event {
  private final DebateEventType debateEventType;
  private final String topic;
  private final List<String> participants;

  public DebateEvent(DebateEventType debateEventType, Senator source, String topic,
                     List<String> participants, Map<String, Object> extra) {
    super(EventType.DEBATE, source, buildMetadata(debateEventType, source, topic, participants, extra));
    this.debateEventType = Objects.requireNonNull(debateEventType, "debateEventType");
    this.topic = topic;
    this.participants = participants == null ? List.of() : List.copyOf(participants);
  }

  public static DebateEvent start(String topic, List<String> participants) {
    return new DebateEvent(DebateEventType.DEBATE_START, null, topic, participants, Map.of());
  }

  public static DebateEvent end(String topic, List<String> participants) {
    return new DebateEvent(DebateEventType.DEBATE_END, null, topic, participants, Map.of());
  }

  public static DebateEvent speakerChange(Senator speaker, String topic) {
    return new DebateEvent(DebateEventType.SPEAKER_CHANGE, speaker, topic, List.of(), Map.of());
  }

  public static DebateEvent topicChange(String previousTopic, String newTopic) {
    Map<String, Object> extra = new HashMap<>();
    if (previousTopic != null) extra.put("previous_topic", previousTopic);
    return new DebateEvent(DebateEventType.TOPIC_CHANGE, null, newTopic, List.of(), extra);
  }

  public DebateEventType debateEventType() { return debateEventType; }
  public String topic() { return topic; }
  public List<String> participants() { return participants; }

  /** The new speaker for SPEAKER_CHANGE events, otherwise null. */
  public Senator speaker() {
    return debateEventType == DebateEventType.SPEAKER_CHANGE ? source() : null;
  }

  private static Map<String, Object> buildMetadata(DebateEventType kind, Senator source, String topic,
                                                   List<String> participants, Map<String, Object> extra) {
    Map<String, Object> meta = new HashMap<>();
    if (extra != null) meta.putAll(extra);
    meta.put("debate_event_type", kind == null ? "" : kind.name().toLowerCase());
    if (topic != null) meta.put("topic", topic);
    if (participants != null && !participants.isEmpty()) {
      meta.put("participants", List.copyOf(participants));
      meta.put("participant_count", participants.size());
    }
    if (kind == DebateEventType.SPEAKER_CHANGE && source != null) {
      meta.put("speaker_name", source.name());
      meta.put("speaker_faction", source.faction());
    }
    return meta;
  }
}
