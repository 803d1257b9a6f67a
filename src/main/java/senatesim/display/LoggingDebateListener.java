package senatesim.display;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.debate.DebateListener;
import senatesim.debate.DebateSummary;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;

import java.util.List;

/**
 * Writes one structured JSON line per debate notification to the {@code senatesim.events} logger.
 */
public class LoggingDebateListener implements DebateListener {
  private static final Logger events = LoggerFactory.getLogger("senatesim.events");

  @Override
  public void onDebateStarted(String topic, List<Senator> participants) {
    if (!events.isInfoEnabled()) return;
    events.info("{}", EventJson.toJson(new Started(topic, participants)));
  }

  @Override
  public void onSpeech(SpeechEvent speech) {
    if (events.isInfoEnabled()) events.info("{}", EventJson.toJson(speech));
  }

  @Override
  public void onReaction(ReactionEvent reaction) {
    if (events.isDebugEnabled()) events.debug("{}", EventJson.toJson(reaction));
  }

  @Override
  public void onInterjection(InterjectionEvent interjection) {
    if (events.isInfoEnabled()) events.info("{}", EventJson.toJson(interjection));
  }

  @Override
  public void onStanceChange(Senator senator, String topic, Stance oldStance, Stance newStance, String reason) {
    if (!events.isInfoEnabled()) return;
    events.info("{}", EventJson.toJson(new StanceShift(senator.name(), topic, oldStance, newStance, reason)));
  }

  @Override
  public void onSpeechFailed(Senator speaker, String topic, Exception error) {
    events.warn("{}", EventJson.toJson(new SpeechFailure(speaker.name(), topic, String.valueOf(error.getMessage()))));
  }

  @Override
  public void onDebateEnded(DebateSummary summary) {
    if (events.isInfoEnabled()) events.info("{}", EventJson.toJson(summary));
  }

  public record Started(String topic, List<Senator> participants) {}

  public record StanceShift(String senator, String topic, Stance oldStance, Stance newStance, String reason) {}

  public record SpeechFailure(String speaker, String topic, String error) {}
}
