package senatesim.debate;

public enum DebateState {
  NOT_STARTED,
  IN_PROGRESS,
  ENDED
}
