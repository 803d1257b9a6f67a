package senatesim.debate;

import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;

import java.util.List;

/**
 * Display and log sink for a debate. Implementations only render or store what they
 * receive; nothing they do feeds back into the debate.
 */
public interface DebateListener {
  DebateListener NONE = new DebateListener() {};

  /** Forwards every notification to each of {@code listeners}, in order. */
  static DebateListener compose(DebateListener... listeners) {
    List<DebateListener> targets = List.of(listeners);
    return new DebateListener() {
      @Override
      public void onDebateStarted(String topic, List<Senator> participants) {
        targets.forEach(l -> l.onDebateStarted(topic, participants));
      }

      @Override
      public void onSpeech(SpeechEvent speech) {
        targets.forEach(l -> l.onSpeech(speech));
      }

      @Override
      public void onReaction(ReactionEvent reaction) {
        targets.forEach(l -> l.onReaction(reaction));
      }

      @Override
      public void onInterjection(InterjectionEvent interjection) {
        targets.forEach(l -> l.onInterjection(interjection));
      }

      @Override
      public void onStanceChange(Senator senator, String topic, Stance oldStance, Stance newStance, String reason) {
        targets.forEach(l -> l.onStanceChange(senator, topic, oldStance, newStance, reason));
      }

      @Override
      public void onSpeechFailed(Senator speaker, String topic, Exception error) {
        targets.forEach(l -> l.onSpeechFailed(speaker, topic, error));
      }

      @Override
      public void onDebateEnded(DebateSummary summary) {
        targets.forEach(l -> l.onDebateEnded(summary));
      }
    };
  }

  default void onDebateStarted(String topic, List<Senator> participants) {}

  default void onSpeech(SpeechEvent speech) {}

  default void onReaction(ReactionEvent reaction) {}

  /** Called for interjections the presiding rules allowed; denied ones are never surfaced. */
  default void onInterjection(InterjectionEvent interjection) {}

  default void onStanceChange(Senator senator, String topic, Stance oldStance, Stance newStance, String reason) {}

  default void onSpeechFailed(Senator speaker, String topic, Exception error) {}

  default void onDebateEnded(DebateSummary summary) {}
}
