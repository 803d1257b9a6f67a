package senatesim.domain;

public enum DebateEventType {
  DEBATE_START,
  DEBATE_END,
  SPEAKER_CHANGE,
  TOPIC_CHANGE
}
