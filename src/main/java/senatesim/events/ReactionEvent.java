package senatesim.events;

import senatesim.domain.ReactionType;
import senatesim.domain.Senator;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class ReactionEvent extends Event {
  private final Senator reactor;
  private final String targetEventId;
  private final EventType targetEventType;
  private final ReactionType reactionType;
  private final String content;

  public ReactionEvent(Senator reactor, Event target, ReactionType reactionType, String content) {
    this(reactor, Objects.requireNonNull(target, "target").id(), target.type(), target.sourceName(),
        reactionType, content);
  }

  public ReactionEvent(Senator reactor, String targetEventId, EventType targetEventType, String targetSpeaker,
                       ReactionType reactionType, String content) {
    super(EventType.REACTION, Objects.requireNonNull(reactor, "reactor"),
        buildMetadata(reactor, targetEventId, targetEventType, targetSpeaker, reactionType));
    this.reactor = reactor;
    this.targetEventId = Objects.requireNonNull(targetEventId, "targetEventId");
    this.targetEventType = targetEventType;
    this.reactionType = reactionType == null ? ReactionType.NEUTRAL : reactionType;
    this.content = content == null ? "" : content;
  }

  public Senator reactor() { return reactor; }
  public String targetEventId() { return targetEventId; }
  public EventType targetEventType() { return targetEventType; }
  public ReactionType reactionType() { return reactionType; }
  public String content() { return content; }

  private static Map<String, Object> buildMetadata(Senator reactor, String targetEventId, EventType targetType,
                                                   String targetSpeaker, ReactionType reactionType) {
    Map<String, Object> meta = new HashMap<>();
    meta.put("reactor_name", reactor.name());
    meta.put("reactor_faction", reactor.faction());
    if (targetEventId != null) meta.put("target_event_id", targetEventId);
    if (targetType != null) meta.put("target_event_type", targetType.name().toLowerCase());
    if (targetSpeaker != null) meta.put("target_speaker", targetSpeaker);
    meta.put("reaction_type", (reactionType == null ? ReactionType.NEUTRAL : reactionType).label());
    return meta;
  }
}
