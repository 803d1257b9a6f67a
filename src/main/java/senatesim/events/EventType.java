package senatesim.events;

/**
 * Routing tag for events on the bus. Every event class maps to exactly one tag.
 */
public enum EventType {
  DEBATE,
  SPEECH,
  REACTION,
  INTERJECTION
}
