package senatesim.memory;

import senatesim.domain.ReactionType;

import java.time.Instant;

public record ReactionRecord(String eventId, ReactionType reactionType, String content, Instant timestamp) {}
