package senatesim.speech;

/**
 * Text model that answers a prompt with a JSON document.
 */
@FunctionalInterface
public interface TextModelClient {
  String generateJson(String prompt) throws Exception;
}
