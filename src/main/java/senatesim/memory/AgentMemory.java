package senatesim.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.domain.ReactionType;
import senatesim.domain.Stance;
import senatesim.events.Event;
import senatesim.events.EventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AgentMemory is one senator's private record of what it observed and decided.
 *
 * <p>All logs are append-only. Each query is answered from an index that is updated on
 * append, so lookups never rescan the full history. Relationship scores are the clamped
 * running sum of recorded impacts.
 */
public class AgentMemory {
  private static final Logger log = LoggerFactory.getLogger(AgentMemory.class);

  public static final double MIN_RELATIONSHIP = -1.0;
  public static final double MAX_RELATIONSHIP = 1.0;

  private final String owner;

  private final List<EventRecord> eventHistory = new ArrayList<>();
  private final Map<EventType, List<EventRecord>> eventsByType = new EnumMap<>(EventType.class);
  private final Map<String, List<EventRecord>> eventsBySource = new HashMap<>();

  private final List<ReactionRecord> reactionHistory = new ArrayList<>();
  private final Map<String, List<ReactionRecord>> reactionsByEvent = new HashMap<>();

  private final Map<String, Stance> assignedStances = new LinkedHashMap<>();
  private final Map<String, List<StanceChange>> stanceChanges = new LinkedHashMap<>();

  private final Map<String, List<RelationshipImpact>> relationshipImpacts = new LinkedHashMap<>();
  private final Map<String, Double> relationshipScores = new HashMap<>();

  private final List<Interaction> interactions = new ArrayList<>();
  private final Map<String, List<Interaction>> interactionsBySenator = new HashMap<>();

  public AgentMemory(String owner) {
    this.owner = owner == null ? "" : owner;
  }

  public String owner() { return owner; }

  public EventRecord recordEvent(Event event) {
    if (event == null) throw new IllegalArgumentException("event must not be null");
    EventRecord record = new EventRecord(event.id(), event.type(), event.timestamp(), event.sourceName(),
        event.metadata());
    eventHistory.add(record);
    eventsByType.computeIfAbsent(record.type(), ignored -> new ArrayList<>()).add(record);
    eventsBySource.computeIfAbsent(record.sourceName(), ignored -> new ArrayList<>()).add(record);
    log.debug("{} recorded event {} ({})", owner, event.id(), event.type());
    return record;
  }

  public ReactionRecord recordReaction(String eventId, ReactionType reactionType, String content) {
    if (eventId == null) throw new IllegalArgumentException("eventId must not be null");
    ReactionRecord record = new ReactionRecord(eventId, reactionType, content == null ? "" : content, Instant.now());
    reactionHistory.add(record);
    reactionsByEvent.computeIfAbsent(eventId, ignored -> new ArrayList<>()).add(record);
    return record;
  }

  /**
   * Sets the stance a trace for {@code topic} starts from. Only the first assignment counts;
   * later calls leave the original anchor in place.
   */
  public void recordAssignedStance(String topic, Stance stance) {
    if (topic == null || stance == null) return;
    assignedStances.putIfAbsent(topic, stance);
  }

  public Stance assignedStance(String topic) {
    return assignedStances.get(topic);
  }

  /** Stance currently held on {@code topic}: the newest change, else the assigned stance. */
  public Stance currentStance(String topic) {
    List<StanceChange> changes = stanceChanges.get(topic);
    if (changes != null && !changes.isEmpty()) {
      return changes.get(changes.size() - 1).newStance();
    }
    return assignedStances.get(topic);
  }

  /**
   * Appends a stance change. The old stance must continue the existing trace for the topic.
   */
  public StanceChange recordStanceChange(String topic, Stance oldStance, Stance newStance,
                                         String reason, String eventId) {
    if (topic == null) throw new IllegalArgumentException("topic must not be null");
    if (newStance == null) throw new IllegalArgumentException("newStance must not be null");
    Stance expected = currentStance(topic);
    if (expected != null && expected != oldStance) {
      throw new IllegalArgumentException("Stance change on " + topic + " starts from " + oldStance
          + " but the trace is at " + expected);
    }
    if (expected == null && oldStance != null) {
      assignedStances.put(topic, oldStance);
    }
    StanceChange change = new StanceChange(oldStance, newStance, reason == null ? "" : reason, eventId, Instant.now());
    stanceChanges.computeIfAbsent(topic, ignored -> new ArrayList<>()).add(change);
    log.debug("{} stance on {}: {} -> {}", owner, topic, oldStance, newStance);
    return change;
  }

  /**
   * Records how an event moved the relationship with {@code senatorName}. The cached score
   * is clamped to [{@value #MIN_RELATIONSHIP}, {@value #MAX_RELATIONSHIP}].
   */
  public RelationshipImpact recordRelationshipImpact(String senatorName, String eventId,
                                                     double delta, String reason) {
    if (senatorName == null) throw new IllegalArgumentException("senatorName must not be null");
    if (Double.isNaN(delta) || Double.isInfinite(delta)) {
      throw new IllegalArgumentException("Relationship delta must be finite: " + delta);
    }
    RelationshipImpact impact = new RelationshipImpact(eventId, delta, reason == null ? "" : reason, Instant.now());
    relationshipImpacts.computeIfAbsent(senatorName, ignored -> new ArrayList<>()).add(impact);
    double score = relationshipScores.getOrDefault(senatorName, 0.0) + delta;
    relationshipScores.put(senatorName, clamp(score));
    return impact;
  }

  public Interaction recordInteraction(String senatorName, String kind, Map<String, Object> details) {
    if (senatorName == null) throw new IllegalArgumentException("senatorName must not be null");
    Interaction interaction = new Interaction(senatorName, kind, details);
    interactions.add(interaction);
    interactionsBySenator.computeIfAbsent(senatorName, ignored -> new ArrayList<>()).add(interaction);
    return interaction;
  }

  public double relationshipScore(String senatorName) {
    if (senatorName == null) return 0.0;
    return relationshipScores.getOrDefault(senatorName, 0.0);
  }

  public List<EventRecord> eventsByType(EventType type) {
    return view(eventsByType.get(type));
  }

  public List<EventRecord> eventsBySource(String sourceName) {
    return view(eventsBySource.get(sourceName));
  }

  public List<ReactionRecord> reactionsTo(String eventId) {
    return view(reactionsByEvent.get(eventId));
  }

  public List<StanceChange> stanceChangesFor(String topic) {
    return view(stanceChanges.get(topic));
  }

  public List<RelationshipImpact> relationshipImpactsBy(String senatorName) {
    return view(relationshipImpacts.get(senatorName));
  }

  public List<Interaction> interactionsWith(String senatorName) {
    return view(interactionsBySenator.get(senatorName));
  }

  /** Most recent {@code count} observed events, newest last. */
  public List<EventRecord> recentEvents(int count) {
    if (count <= 0 || eventHistory.isEmpty()) return List.of();
    return view(eventHistory.subList(Math.max(0, eventHistory.size() - count), eventHistory.size()));
  }

  public List<EventRecord> eventHistory() { return view(eventHistory); }
  public List<ReactionRecord> reactionHistory() { return view(reactionHistory); }

  public MemorySnapshot snapshot() {
    Map<String, List<StanceChange>> changes = new LinkedHashMap<>();
    stanceChanges.forEach((topic, list) -> changes.put(topic, List.copyOf(list)));
    Map<String, List<RelationshipImpact>> impacts = new LinkedHashMap<>();
    relationshipImpacts.forEach((name, list) -> impacts.put(name, List.copyOf(list)));
    return new MemorySnapshot(
        owner,
        List.copyOf(eventHistory),
        List.copyOf(reactionHistory),
        Collections.unmodifiableMap(new LinkedHashMap<>(assignedStances)),
        Collections.unmodifiableMap(changes),
        Collections.unmodifiableMap(impacts),
        Collections.unmodifiableMap(new LinkedHashMap<>(relationshipScores)),
        List.copyOf(interactions)
    );
  }

  private static double clamp(double score) {
    return Math.max(MIN_RELATIONSHIP, Math.min(MAX_RELATIONSHIP, score));
  }

  private static <T> List<T> view(List<T> list) {
    if (list == null || list.isEmpty()) return List.of();
    return List.copyOf(list);
  }
}
