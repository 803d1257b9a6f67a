package senatesim.memory;

import java.time.Instant;

/** A change to the relationship with another senator, attributed to an event when one caused it. */
public record RelationshipImpact(String eventId, double delta, String reason, Instant timestamp) {}
