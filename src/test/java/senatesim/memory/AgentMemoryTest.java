package senatesim.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import senatesim.domain.ReactionType;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.DebateEvent;
import senatesim.events.EventType;
import senatesim.events.SpeechEvent;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AgentMemoryTest {

  private final Senator cato = new Senator("cato", "Cato", "Optimates", 4);
  private final Senator caesar = new Senator("caesar", "Caesar", "Populares", 3);

  private AgentMemory memory;

  @BeforeEach
  void setUp() {
    memory = new AgentMemory("Cicero");
  }

  @Test
  void recordEvent_indexesByTypeAndSource() {
    SpeechEvent s1 = new SpeechEvent(cato, "Land Reform", "a", Stance.OPPOSE, List.of());
    SpeechEvent s2 = new SpeechEvent(caesar, "Land Reform", "b", Stance.SUPPORT, List.of());
    DebateEvent start = DebateEvent.start("Land Reform", List.of("Cato", "Caesar"));

    memory.recordEvent(start);
    memory.recordEvent(s1);
    memory.recordEvent(s2);

    assertThat(memory.eventsByType(EventType.SPEECH)).extracting(EventRecord::eventId)
        .containsExactly(s1.id(), s2.id());
    assertThat(memory.eventsBySource("Caesar")).extracting(EventRecord::eventId).containsExactly(s2.id());
    assertThat(memory.eventsBySource("Unknown")).extracting(EventRecord::eventId).containsExactly(start.id());
    assertThat(memory.eventsByType(EventType.INTERJECTION)).isEmpty();
    assertThat(memory.eventHistory()).hasSize(3);
  }

  @Test
  void recentEvents_returnsNewestLast() {
    SpeechEvent s1 = new SpeechEvent(cato, "t", "a", Stance.OPPOSE, List.of());
    SpeechEvent s2 = new SpeechEvent(caesar, "t", "b", Stance.SUPPORT, List.of());
    SpeechEvent s3 = new SpeechEvent(cato, "t", "c", Stance.OPPOSE, List.of());
    memory.recordEvent(s1);
    memory.recordEvent(s2);
    memory.recordEvent(s3);

    assertThat(memory.recentEvents(2)).extracting(EventRecord::eventId).containsExactly(s2.id(), s3.id());
    assertThat(memory.recentEvents(0)).isEmpty();
  }

  @Test
  void reactions_areKeyedToEvent() {
    memory.recordReaction("speech-1", ReactionType.AGREEMENT, "nods");
    memory.recordReaction("speech-2", ReactionType.BOREDOM, "yawns");
    memory.recordReaction("speech-1", ReactionType.INTEREST, "leans in");

    assertThat(memory.reactionsTo("speech-1")).extracting(ReactionRecord::reactionType)
        .containsExactly(ReactionType.AGREEMENT, ReactionType.INTEREST);
    assertThat(memory.reactionHistory()).hasSize(3);
  }

  @Test
  void stanceChanges_chainFromAssignedStance() {
    memory.recordAssignedStance("Land Reform", Stance.OPPOSE);
    memory.recordStanceChange("Land Reform", Stance.OPPOSE, Stance.NEUTRAL, "Persuaded", "e1");
    memory.recordStanceChange("Land Reform", Stance.NEUTRAL, Stance.SUPPORT, "Persuaded again", "e2");

    List<StanceChange> changes = memory.stanceChangesFor("Land Reform");
    assertThat(changes).extracting(StanceChange::oldStance).containsExactly(Stance.OPPOSE, Stance.NEUTRAL);
    assertThat(changes).extracting(StanceChange::newStance).containsExactly(Stance.NEUTRAL, Stance.SUPPORT);
    for (int i = 1; i < changes.size(); i++) {
      assertThat(changes.get(i).oldStance()).isEqualTo(changes.get(i - 1).newStance());
      assertThat(changes.get(i).timestamp()).isAfterOrEqualTo(changes.get(i - 1).timestamp());
    }
    assertThat(memory.currentStance("Land Reform")).isEqualTo(Stance.SUPPORT);
    assertThat(memory.assignedStance("Land Reform")).isEqualTo(Stance.OPPOSE);
  }

  @Test
  void stanceChange_breakingTheTraceIsRejected() {
    memory.recordAssignedStance("Land Reform", Stance.OPPOSE);

    assertThatThrownBy(() -> memory.recordStanceChange("Land Reform", Stance.SUPPORT, Stance.NEUTRAL, "x", null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(memory.stanceChangesFor("Land Reform")).isEmpty();
  }

  @Test
  void firstChangeWithoutAssignment_anchorsTheTrace() {
    memory.recordStanceChange("Grain Dole", Stance.NEUTRAL, Stance.SUPPORT, "Convinced", null);

    assertThat(memory.assignedStance("Grain Dole")).isEqualTo(Stance.NEUTRAL);
    assertThat(memory.currentStance("Grain Dole")).isEqualTo(Stance.SUPPORT);
  }

  @Test
  void assignedStance_keepsFirstValue() {
    memory.recordAssignedStance("t", Stance.SUPPORT);
    memory.recordAssignedStance("t", Stance.OPPOSE);

    assertThat(memory.currentStance("t")).isEqualTo(Stance.SUPPORT);
  }

  @Test
  void relationshipScore_accumulatesAndClamps() {
    memory.recordRelationshipImpact("Cato", "e1", 0.6, "Agreement");
    memory.recordRelationshipImpact("Cato", "e2", 0.7, "Agreement");
    memory.recordRelationshipImpact("Caesar", "e3", -0.2, "Challenge");

    assertThat(memory.relationshipScore("Cato")).isEqualTo(AgentMemory.MAX_RELATIONSHIP);
    assertThat(memory.relationshipScore("Caesar")).isCloseTo(-0.2, within(1e-9));
    assertThat(memory.relationshipScore("Nobody")).isZero();
    assertThat(memory.relationshipImpactsBy("Cato")).extracting(RelationshipImpact::eventId)
        .containsExactly("e1", "e2");

    for (int i = 0; i < 20; i++) memory.recordRelationshipImpact("Caesar", null, -0.2, "Insult");
    assertThat(memory.relationshipScore("Caesar")).isEqualTo(AgentMemory.MIN_RELATIONSHIP);
  }

  @Test
  void relationshipImpact_rejectsNonFiniteDelta() {
    assertThatThrownBy(() -> memory.recordRelationshipImpact("Cato", null, Double.NaN, "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void interactions_areGroupedBySenator() {
    memory.recordInteraction("Cato", "heard_speech", Map.of("topic", "Land Reform"));
    memory.recordInteraction("Caesar", "heard_speech", Map.of("topic", "Land Reform"));

    assertThat(memory.interactionsWith("Cato")).hasSize(1);
    assertThat(memory.interactionsWith("Cato").get(0).details()).containsEntry("topic", "Land Reform");
  }

  @Test
  void queries_returnDetachedCopies() {
    memory.recordReaction("e1", ReactionType.NEUTRAL, "");
    List<ReactionRecord> before = memory.reactionsTo("e1");
    memory.recordReaction("e1", ReactionType.AGREEMENT, "");

    assertThat(before).hasSize(1);
    assertThatThrownBy(() -> before.add(null)).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void snapshot_capturesAllLogs() {
    memory.recordEvent(new SpeechEvent(cato, "t", "a", Stance.OPPOSE, List.of()));
    memory.recordAssignedStance("t", Stance.NEUTRAL);
    memory.recordStanceChange("t", Stance.NEUTRAL, Stance.OPPOSE, "Persuaded", null);
    memory.recordRelationshipImpact("Cato", null, 0.1, "Support");

    MemorySnapshot snapshot = memory.snapshot();

    assertThat(snapshot.owner()).isEqualTo("Cicero");
    assertThat(snapshot.events()).hasSize(1);
    assertThat(snapshot.assignedStances()).containsEntry("t", Stance.NEUTRAL);
    assertThat(snapshot.stanceChanges().get("t")).hasSize(1);
    assertThat(snapshot.relationshipScores()).containsEntry("Cato", 0.1);
  }
}
