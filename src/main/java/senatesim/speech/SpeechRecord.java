package senatesim.speech;

import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.List;

/** A speech as delivered on the floor, kept in the debate transcript. */
public record SpeechRecord(String speechId, Senator speaker, String topic, Stance stance,
                           String content, List<String> keyPoints) {
  public SpeechRecord {
    keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
  }
}
