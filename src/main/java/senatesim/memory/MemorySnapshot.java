package senatesim.memory;

import senatesim.domain.Stance;

import java.util.List;
import java.util.Map;

/**
 * Plain-data view of an {@link AgentMemory}, suitable for handing to a serializer.
 */
public record MemorySnapshot(String owner,
                             List<EventRecord> events,
                             List<ReactionRecord> reactions,
                             Map<String, Stance> assignedStances,
                             Map<String, List<StanceChange>> stanceChanges,
                             Map<String, List<RelationshipImpact>> relationshipImpacts,
                             Map<String, Double> relationshipScores,
                             List<Interaction> interactions) {}
