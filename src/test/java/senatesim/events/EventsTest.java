package senatesim.events;

import org.junit.jupiter.api.Test;
import senatesim.domain.DebateEventType;
import senatesim.domain.InterjectionType;
import senatesim.domain.ReactionType;
import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventsTest {

  private final Senator cato = new Senator("cato", "Cato", "Optimates", 4);
  private final Senator caesar = new Senator("caesar", "Caesar", "Populares", 3);

  @Test
  void priority_defaultsToSourceRank() {
    SpeechEvent speech = new SpeechEvent(cato, "Land Reform", "text", Stance.OPPOSE, List.of());

    assertThat(speech.priority()).isEqualTo(4);
    assertThat(DebateEvent.start("Land Reform", List.of("Cato")).priority()).isZero();
  }

  @Test
  void events_getDistinctIds() {
    SpeechEvent a = new SpeechEvent(cato, "t", "x", Stance.SUPPORT, List.of());
    SpeechEvent b = new SpeechEvent(cato, "t", "x", Stance.SUPPORT, List.of());

    assertThat(a.id()).isNotEqualTo(b.id());
    assertThat(a.speechId()).isEqualTo(a.id());
  }

  @Test
  void speechEvent_copiesKeyPointsAndMetadataIsReadOnly() {
    List<String> points = new ArrayList<>(List.of("one"));
    SpeechEvent speech = new SpeechEvent(cato, "Land Reform", "text", null, points);
    points.add("two");

    assertThat(speech.keyPoints()).containsExactly("one");
    assertThat(speech.stance()).isEqualTo(Stance.NEUTRAL);
    assertThat(speech.metadata()).containsEntry("speaker_name", "Cato").containsEntry("stance", "neutral");
    assertThatThrownBy(() -> speech.metadata().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> speech.keyPoints().add("x")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void speakerChange_carriesSpeakerAsSource() {
    DebateEvent change = DebateEvent.speakerChange(caesar, "Land Reform");

    assertThat(change.debateEventType()).isEqualTo(DebateEventType.SPEAKER_CHANGE);
    assertThat(change.speaker()).isEqualTo(caesar);
    assertThat(change.metadata()).containsEntry("speaker_name", "Caesar");
    assertThat(DebateEvent.start("Land Reform", List.of("Cato")).speaker()).isNull();
  }

  @Test
  void debateStart_carriesParticipants() {
    DebateEvent start = DebateEvent.start("Land Reform", List.of("Cato", "Caesar"));

    assertThat(start.participants()).containsExactly("Cato", "Caesar");
    assertThat(start.metadata()).containsEntry("participant_count", 2).containsEntry("topic", "Land Reform");
  }

  @Test
  void topicChange_recordsPreviousTopic() {
    DebateEvent change = DebateEvent.topicChange("Land Reform", "Grain Dole");

    assertThat(change.topic()).isEqualTo("Grain Dole");
    assertThat(change.metadata()).containsEntry("previous_topic", "Land Reform");
  }

  @Test
  void reaction_referencesTargetEvent() {
    SpeechEvent speech = new SpeechEvent(cato, "Land Reform", "text", Stance.OPPOSE, List.of());
    ReactionEvent reaction = new ReactionEvent(caesar, speech, ReactionType.SKEPTICISM, "raises an eyebrow");

    assertThat(reaction.targetEventId()).isEqualTo(speech.id());
    assertThat(reaction.targetEventType()).isEqualTo(EventType.SPEECH);
    assertThat(reaction.metadata()).containsEntry("target_speaker", "Cato").containsEntry("reaction_type", "skepticism");
  }

  @Test
  void interjection_disruptionFollowsType() {
    assertThat(interjection(InterjectionType.PROCEDURAL).causesDisruption()).isTrue();
    assertThat(interjection(InterjectionType.EMOTIONAL).causesDisruption()).isTrue();
    assertThat(interjection(InterjectionType.CHALLENGE).causesDisruption()).isFalse();
    assertThat(interjection(InterjectionType.SUPPORT).causesDisruption()).isFalse();
    assertThat(interjection(InterjectionType.INFORMATIONAL).causesDisruption()).isFalse();
  }

  @Test
  void sourceName_fallsBackToUnknown() {
    assertThat(DebateEvent.end("Land Reform", List.of()).sourceName()).isEqualTo("Unknown");
  }

  private InterjectionEvent interjection(InterjectionType type) {
    return new InterjectionEvent(caesar, cato, type, "Nego!", "I deny it!", "speech-1");
  }
}
