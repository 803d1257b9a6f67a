package senatesim.speech;

/**
 * Produces speech content for a senator. Implementations report failure by throwing,
 * never by returning an empty speech.
 */
@FunctionalInterface
public interface SpeechGenerator {
  SpeechContent generate(SpeechRequest request) throws SpeechGenerationException;
}
