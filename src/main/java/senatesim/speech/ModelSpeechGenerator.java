package senatesim.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generator backed by a text model. Output that does not parse is retried once with a
 * stricter prompt; a second failure is reported to the caller.
 */
public class ModelSpeechGenerator implements SpeechGenerator {
  private static final Logger log = LoggerFactory.getLogger(ModelSpeechGenerator.class);

  private final TextModelClient client;
  private final SpeechPromptBuilder prompts;

  public ModelSpeechGenerator(TextModelClient client, SpeechPromptBuilder prompts) {
    if (client == null) throw new IllegalArgumentException("client must not be null");
    this.client = client;
    this.prompts = prompts == null ? new SpeechPromptBuilder() : prompts;
  }

  @Override
  public SpeechContent generate(SpeechRequest request) throws SpeechGenerationException {
    String prompt = prompts.buildSpeechPrompt(request);
    String json = call(prompt);
    try {
      return SpeechContent.fromJson(json);
    } catch (SpeechGenerationException e) {
      log.info("[Model] Invalid JSON for {}. Retrying...", request.speaker().name());
      return SpeechContent.fromJson(call(prompts.buildRetryPrompt(prompt)));
    }
  }

  private String call(String prompt) throws SpeechGenerationException {
    try {
      return client.generateJson(prompt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SpeechGenerationException("Interrupted while waiting for the model", e);
    } catch (Exception e) {
      throw new SpeechGenerationException("Model call failed: " + e.getMessage(), e);
    }
  }
}
