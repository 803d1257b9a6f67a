package senatesim.memory;

import senatesim.events.EventType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Compact projection of an observed event. */
public record EventRecord(String eventId, EventType type, Instant timestamp, String sourceName,
                          Map<String, Object> metadata) {
  public EventRecord {
    metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
