package senatesim.speech;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import senatesim.domain.Stance;

import java.util.ArrayList;
import java.util.List;

/**
 * Speech text, the stance it argues and its key points, as returned by a generator.
 */
public class SpeechContent {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public String text;
  public String stance;          // support|oppose|neutral
  public List<String> keyPoints = new ArrayList<>();

  public SpeechContent() {}

  public SpeechContent(String text, Stance stance, List<String> keyPoints) {
    this.text = text;
    this.stance = stance == null ? null : stance.label();
    this.keyPoints = keyPoints == null ? new ArrayList<>() : new ArrayList<>(keyPoints);
  }

  public Stance stanceValue() {
    Stance parsed = Stance.fromLabel(stance);
    return parsed == null ? Stance.NEUTRAL : parsed;
  }

  public List<String> keyPointsView() {
    return keyPoints == null ? List.of() : List.copyOf(keyPoints);
  }

  public boolean isBlank() {
    return text == null || text.isBlank();
  }

  /**
   * Parses generator output. Tolerates prose around the JSON object, a single string where
   * an array is expected, and "speech"/"content" as aliases for "text".
   *
   * @throws SpeechGenerationException if no JSON object can be found or it carries no text
   */
  public static SpeechContent fromJson(String json) throws SpeechGenerationException {
    JsonNode root = readObject(json);
    if (root == null) {
      throw new SpeechGenerationException("Generator output is not a JSON object");
    }
    ObjectNode normalized = ((ObjectNode) root).deepCopy();
    aliasText(normalized);
    normalizeStringArray(normalized, "keyPoints");

    SpeechContent out;
    try {
      out = MAPPER.treeToValue(normalized, SpeechContent.class);
    } catch (Exception e) {
      throw new SpeechGenerationException("Generator output does not match speech shape", e);
    }
    if (out.isBlank()) {
      throw new SpeechGenerationException("Generator returned an empty speech");
    }
    out.text = out.text.trim();
    out.stance = out.stanceValue().label();
    out.keyPoints = sanitizeList(out.keyPoints);
    return out;
  }

  private static JsonNode readObject(String json) {
    if (json == null || json.isBlank()) return null;
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (Exception e) {
      String extracted = extractJsonObject(json);
      if (extracted == null) return null;
      try {
        root = MAPPER.readTree(extracted);
      } catch (Exception nested) {
        return null;
      }
    }
    return root != null && root.isObject() ? root : null;
  }

  private static void aliasText(ObjectNode root) {
    JsonNode text = root.get("text");
    if (text != null && text.isTextual() && !text.asText().isBlank()) return;
    for (String alias : List.of("speech", "content")) {
      JsonNode node = root.get(alias);
      if (node != null && node.isTextual() && !node.asText().isBlank()) {
        root.put("text", node.asText());
        break;
      }
    }
    root.remove("speech");
    root.remove("content");
  }

  private static void normalizeStringArray(ObjectNode root, String field) {
    JsonNode node = root.get(field);
    ArrayNode array = root.arrayNode();
    if (node == null || node.isNull()) {
      root.set(field, array);
      return;
    }
    if (node.isArray()) {
      for (JsonNode item : node) {
        if (item != null && !item.isNull()) array.add(item.isTextual() ? item.asText() : item.toString());
      }
    } else {
      array.add(node.asText());
    }
    root.set(field, array);
  }

  private static String extractJsonObject(String json) {
    int start = json.indexOf('{');
    int end = json.lastIndexOf('}');
    if (start < 0 || end <= start) return null;
    return json.substring(start, end + 1);
  }

  private static List<String> sanitizeList(List<String> items) {
    List<String> cleaned = new ArrayList<>();
    if (items == null) return cleaned;
    for (String item : items) {
      if (item == null) continue;
      String trimmed = item.trim();
      if (!trimmed.isEmpty()) cleaned.add(trimmed);
    }
    return cleaned;
  }
}
