package senatesim.domain;

public enum InterjectionType {
  SUPPORT,
  CHALLENGE,
  PROCEDURAL,
  EMOTIONAL,
  INFORMATIONAL;

  /** Procedural and emotional interjections break the flow of the current speech. */
  public boolean causesDisruption() {
    return this == PROCEDURAL || this == EMOTIONAL;
  }

  public String label() {
    return name().toLowerCase();
  }
}
