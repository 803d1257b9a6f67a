package senatesim.speech;

import senatesim.domain.Stance;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Offline generator assembling speeches from stock phrases. Output depends only on the
 * request and the seeded {@link Random}, which makes it the default for demos and tests.
 */
public class TemplateSpeechGenerator implements SpeechGenerator {
  private static final List<String> OPENINGS = List.of(
      "Senators,",
      "Fellow patricians,",
      "Esteemed colleagues,",
      "Noble representatives of our Republic,");

  private static final Map<Stance, List<String>> STANCE_PHRASES = new EnumMap<>(Stance.class);
  private static final Map<String, String> FACTION_INTERESTS = Map.of(
      "optimates", "the traditions of our ancestors",
      "populares", "the welfare of the common people",
      "military", "the strength of our legions",
      "religious", "the will of the gods",
      "merchant", "our commercial interests");

  static {
    STANCE_PHRASES.put(Stance.SUPPORT, List.of(
        "I strongly support this measure on %s.",
        "The future of the Republic depends on our approval of %s."));
    STANCE_PHRASES.put(Stance.OPPOSE, List.of(
        "I must oppose this proposal regarding %s.",
        "For the good of the Republic, we must reject this measure on %s."));
    STANCE_PHRASES.put(Stance.NEUTRAL, List.of(
        "The question of %s requires careful deliberation before we decide.",
        "I call for more discussion on the implications of %s."));
  }

  private final Random rng;

  public TemplateSpeechGenerator(Random rng) {
    this.rng = rng == null ? new Random() : rng;
  }

  @Override
  public SpeechContent generate(SpeechRequest request) throws SpeechGenerationException {
    String topic = request.topic();
    if (topic == null || topic.isBlank()) {
      throw new SpeechGenerationException("No topic given for " + request.speaker().name());
    }
    Stance stance = request.stanceHint() != null
        ? request.stanceHint()
        : Stance.values()[rng.nextInt(Stance.values().length)];

    List<String> phrases = STANCE_PHRASES.get(stance);
    String opening = OPENINGS.get(rng.nextInt(OPENINGS.size()));
    String mainPoint = phrases.get(rng.nextInt(phrases.size())).formatted(topic);
    String interest = FACTION_INTERESTS.getOrDefault(request.speaker().faction().toLowerCase(), "the future of the Republic");

    StringBuilder text = new StringBuilder()
        .append(opening).append(' ')
        .append(mainPoint).append(' ')
        .append("As we consider ").append(interest).append(", we must act wisely.");

    List<String> keyPoints = new ArrayList<>();
    keyPoints.add(mainPoint);
    keyPoints.add("Guided by " + interest);

    SpeechRecord previous = lastByOthers(request);
    if (previous != null) {
      boolean agrees = previous.stance() == stance;
      text.append(' ').append(agrees
          ? "I stand with " + previous.speaker().name() + " on this."
          : "I cannot accept what " + previous.speaker().name() + " has argued.");
      keyPoints.add((agrees ? "Agrees with " : "Answers ") + previous.speaker().name());
    }
    return new SpeechContent(text.toString(), stance, keyPoints);
  }

  private static SpeechRecord lastByOthers(SpeechRequest request) {
    List<SpeechRecord> prior = request.priorSpeeches();
    for (int i = prior.size() - 1; i >= 0; i--) {
      SpeechRecord record = prior.get(i);
      if (!request.speaker().sameSenatorAs(record.speaker())) return record;
    }
    return null;
  }
}
