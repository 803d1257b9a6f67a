package senatesim.agents;

public enum AgentState {
  /** Not engaged in a debate. */
  IDLE,
  /** Debate running, someone else holds the floor. */
  OBSERVING,
  /** Holds the floor until its own speech has been published. */
  SPEAKING
}
