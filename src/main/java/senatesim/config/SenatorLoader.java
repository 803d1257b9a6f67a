package senatesim.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the senate roster, a JSON array of senator entries, from a file or the classpath.
 */
public class SenatorLoader {
  public static final String DEFAULT_ROSTER_RESOURCE = "senators.json";

  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public List<SenatorConfig> load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Roster file not found: " + path);
    }
    return parse(Files.readString(path), path.toString());
  }

  public List<SenatorConfig> loadResource(String resource) throws IOException {
    try (InputStream in = SenatorLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Roster resource not found on classpath: " + resource);
      }
      return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
    }
  }

  /** Loads {@code path} when given, otherwise the bundled roster. */
  public List<SenatorConfig> load(String path) throws IOException {
    if (path == null || path.isBlank()) return loadResource(DEFAULT_ROSTER_RESOURCE);
    return load(Path.of(path));
  }

  List<SenatorConfig> parse(String raw, String origin) throws IOException {
    String trimmed = raw == null ? "" : raw.trim();
    if (trimmed.isEmpty()) {
      throw new IOException("Roster " + origin + " is empty");
    }
    SenatorConfig[] entries = mapper.readValue(trimmed, SenatorConfig[].class);
    List<SenatorConfig> list = new ArrayList<>();
    Set<String> ids = new HashSet<>();
    for (SenatorConfig entry : entries) {
      if (entry == null) continue;
      if (entry.id == null || entry.id.isBlank()) {
        throw new IllegalArgumentException("Senator without id in " + origin);
      }
      if (entry.name == null || entry.name.isBlank()) {
        throw new IllegalArgumentException("Senator " + entry.id + " has no name in " + origin);
      }
      if (!ids.add(entry.id)) {
        throw new IllegalArgumentException("Duplicate senator id " + entry.id + " in " + origin);
      }
      list.add(entry);
    }
    if (list.isEmpty()) {
      throw new IOException("Roster " + origin + " lists no senators");
    }
    return list;
  }

  public static class SenatorConfig {
    public String id;
    public String name;
    public String faction;
    public int rank;
    public String stance;                                        // support|oppose|neutral, optional
    public Map<String, Double> relationships = new LinkedHashMap<>(); // senator name -> initial score

    public Senator toSenator() {
      return new Senator(id.trim(), name.trim(), faction, rank);
    }

    /** Declared starting stance, or null when the entry leaves it open. */
    public Stance initialStance() {
      return Stance.fromLabel(stance);
    }
  }
}
