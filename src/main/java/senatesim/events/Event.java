package senatesim.events;

import senatesim.domain.Senator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Common envelope for everything published on the {@link EventBus}.
 *
 * <p>Events are immutable once constructed. Handlers receive the same instance
 * and must treat it as read-only; the metadata map is an unmodifiable copy.
 */
public abstract class Event {
  private final String id;
  private final EventType type;
  private final Instant timestamp;
  private final Senator source;
  private final Map<String, Object> metadata;
  private final int priority;

  protected Event(EventType type, Senator source, Map<String, Object> metadata) {
    this(type, source, metadata, source == null ? 0 : source.rank());
  }

  protected Event(EventType type, Senator source, Map<String, Object> metadata, int priority) {
    this.id = UUID.randomUUID().toString();
    this.type = Objects.requireNonNull(type, "type");
    this.timestamp = Instant.now();
    this.source = source;
    this.metadata = metadata == null || metadata.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    this.priority = priority;
  }

  public String id() { return id; }
  public EventType type() { return type; }
  public Instant timestamp() { return timestamp; }
  public Senator source() { return source; }
  public Map<String, Object> metadata() { return metadata; }
  public int priority() { return priority; }

  public String sourceName() {
    return source == null ? "Unknown" : source.name();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", type=" + type + ", source=" + sourceName() + "}";
  }
}
