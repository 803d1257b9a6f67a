package senatesim.debate;

import senatesim.events.InterjectionEvent;

import java.time.Instant;

/** Outcome of arbitrating one interjection against the senator holding the floor. */
public record ArbitrationRecord(InterjectionEvent interjection, String speakerName, boolean allowed, Instant decidedAt) {
  public String interjectorName() {
    return interjection.interjector().name();
  }
}
