package senatesim.debate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Closing statistics for a debate.
 *
 * @param mostActiveSpeaker name of the senator with the most speeches, or null if nobody spoke;
 *                          ties go to the senator who spoke first
 */
public record DebateSummary(
    String topic,
    List<String> participants,
    Duration duration,
    int speechCount,
    Map<String, Integer> speechesBySpeaker,
    int interjectionCount,
    int allowedInterjectionCount,
    int reactionCount,
    String mostActiveSpeaker
) {
  public DebateSummary {
    participants = participants == null ? List.of() : List.copyOf(participants);
    speechesBySpeaker = speechesBySpeaker == null ? Map.of() : Map.copyOf(speechesBySpeaker);
  }

  public int deniedInterjectionCount() {
    return interjectionCount - allowedInterjectionCount;
  }
}
