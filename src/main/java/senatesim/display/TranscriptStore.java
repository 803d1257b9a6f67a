package senatesim.display;

import senatesim.debate.DebateListener;
import senatesim.debate.DebateSummary;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory, human-readable transcript of a debate. Readers poll with
 * {@link #snapshotFrom(int)} and resume from the returned {@code nextIndex}.
 */
public class TranscriptStore implements DebateListener {
  private final List<String> lines = new ArrayList<>();

  public synchronized void addLine(String line) {
    if (line == null) return;
    lines.add(line);
  }

  public synchronized TranscriptSnapshot snapshotFrom(int startIndex) {
    int safeStart = Math.max(0, Math.min(startIndex, lines.size()));
    List<String> slice = new ArrayList<>(lines.subList(safeStart, lines.size()));
    return new TranscriptSnapshot(Collections.unmodifiableList(slice), lines.size());
  }

  public synchronized String lastLine() {
    if (lines.isEmpty()) return "";
    return lines.get(lines.size() - 1);
  }

  public synchronized int size() {
    return lines.size();
  }

  @Override
  public void onDebateStarted(String topic, List<Senator> participants) {
    addLine("[Debate] Opened on " + topic + " with "
        + participants.stream().map(Senator::name).collect(Collectors.joining(", ")));
  }

  @Override
  public void onSpeech(SpeechEvent speech) {
    addLine("[Floor] " + speech.speaker().name() + " (" + speech.stance().label() + "): " + speech.content());
  }

  @Override
  public void onReaction(ReactionEvent reaction) {
    addLine("[Reaction] " + reaction.reactor().name() + ": " + reaction.content());
  }

  @Override
  public void onInterjection(InterjectionEvent interjection) {
    addLine("[Interjection] " + interjection.interjector().name() + " to " + interjection.targetSpeaker().name()
        + ": " + interjection.latinContent() + " (" + interjection.englishContent() + ")");
  }

  @Override
  public void onStanceChange(Senator senator, String topic, Stance oldStance, Stance newStance, String reason) {
    addLine("[Stance] " + senator.name() + " on " + topic + ": " + oldStance.label() + " -> " + newStance.label()
        + " (" + reason + ")");
  }

  @Override
  public void onSpeechFailed(Senator speaker, String topic, Exception error) {
    addLine("[Floor] " + speaker.name() + " yields without speaking: " + error.getMessage());
  }

  @Override
  public void onDebateEnded(DebateSummary summary) {
    addLine("[Debate] Closed on " + summary.topic() + " after " + summary.speechCount() + " speeches"
        + (summary.mostActiveSpeaker() == null ? "" : "; most active: " + summary.mostActiveSpeaker()));
  }

  public static class TranscriptSnapshot {
    public final List<String> lines;
    public final int nextIndex;

    public TranscriptSnapshot(List<String> lines, int nextIndex) {
      this.lines = lines;
      this.nextIndex = nextIndex;
    }
  }
}
