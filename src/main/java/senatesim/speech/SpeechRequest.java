package senatesim.speech;

import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.List;
import java.util.Objects;

/**
 * Everything a generator is told about the speech it should produce.
 *
 * @param stanceHint stance the speaker currently holds, or null when unknown
 * @param priorSpeeches speeches already delivered in this debate, oldest first
 */
public record SpeechRequest(Senator speaker, String topic, Stance stanceHint, List<SpeechRecord> priorSpeeches) {
  public SpeechRequest {
    Objects.requireNonNull(speaker, "speaker");
    priorSpeeches = priorSpeeches == null ? List.of() : List.copyOf(priorSpeeches);
  }
}
