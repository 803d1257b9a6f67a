package senatesim.events;

import senatesim.domain.InterjectionType;
import senatesim.domain.Senator;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class InterjectionEvent extends Event {
  private final Senator interjector;
  private final Senator targetSpeaker;
  private final InterjectionType interjectionType;
  private final String latinContent;
  private final String englishContent;
  private final String targetSpeechId;

  public InterjectionEvent(Senator interjector, Senator targetSpeaker, InterjectionType interjectionType,
                           String latinContent, String englishContent, String targetSpeechId) {
    super(EventType.INTERJECTION, Objects.requireNonNull(interjector, "interjector"),
        buildMetadata(interjector, targetSpeaker, interjectionType, targetSpeechId));
    this.interjector = interjector;
    this.targetSpeaker = Objects.requireNonNull(targetSpeaker, "targetSpeaker");
    this.interjectionType = Objects.requireNonNull(interjectionType, "interjectionType");
    this.latinContent = latinContent == null ? "" : latinContent;
    this.englishContent = englishContent == null ? "" : englishContent;
    this.targetSpeechId = targetSpeechId;
  }

  public Senator interjector() { return interjector; }
  public Senator targetSpeaker() { return targetSpeaker; }
  public InterjectionType interjectionType() { return interjectionType; }
  public String latinContent() { return latinContent; }
  public String englishContent() { return englishContent; }
  public String targetSpeechId() { return targetSpeechId; }

  public boolean causesDisruption() {
    return interjectionType.causesDisruption();
  }

  private static Map<String, Object> buildMetadata(Senator interjector, Senator target, InterjectionType type,
                                                   String targetSpeechId) {
    Map<String, Object> meta = new HashMap<>();
    meta.put("interjector_name", interjector.name());
    if (target != null) meta.put("target_speaker", target.name());
    if (type != null) {
      meta.put("interjection_type", type.label());
      meta.put("causes_disruption", type.causesDisruption());
    }
    if (targetSpeechId != null) meta.put("target_speech_id", targetSpeechId);
    return meta;
  }
}
