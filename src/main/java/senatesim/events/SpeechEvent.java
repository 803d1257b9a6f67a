package senatesim.events;

import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class SpeechEvent extends Event {
  private final Senator speaker;
  private final String topic;
  private final String content;
  private final Stance stance;
  private final List<String> keyPoints;

  public SpeechEvent(Senator speaker, String topic, String content, Stance stance, List<String> keyPoints) {
    super(EventType.SPEECH, Objects.requireNonNull(speaker, "speaker"), buildMetadata(speaker, topic, stance));
    this.speaker = speaker;
    this.topic = topic;
    this.content = content == null ? "" : content;
    this.stance = stance == null ? Stance.NEUTRAL : stance;
    this.keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
  }

  public Senator speaker() { return speaker; }
  public String topic() { return topic; }
  public String content() { return content; }
  public Stance stance() { return stance; }
  public List<String> keyPoints() { return keyPoints; }

  public String speechId() { return id(); }

  private static Map<String, Object> buildMetadata(Senator speaker, String topic, Stance stance) {
    Map<String, Object> meta = new HashMap<>();
    if (topic != null) meta.put("topic", topic);
    meta.put("stance", (stance == null ? Stance.NEUTRAL : stance).label());
    if (speaker != null) {
      meta.put("speaker_name", speaker.name());
      meta.put("speaker_faction", speaker.faction());
    }
    return meta;
  }
}
