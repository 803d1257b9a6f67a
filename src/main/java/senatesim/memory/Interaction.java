package senatesim.memory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Interaction(String senatorName, String kind, Map<String, Object> details) {
  public Interaction {
    details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
