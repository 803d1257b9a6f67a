package senatesim.speech;

public class SpeechGenerationException extends Exception {
  public SpeechGenerationException(String message) {
    super(message);
  }

  public SpeechGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
