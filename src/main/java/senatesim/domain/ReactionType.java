package senatesim.domain;

public enum ReactionType {
  AGREEMENT,
  DISAGREEMENT,
  INTEREST,
  BOREDOM,
  SKEPTICISM,
  NEUTRAL;

  public String label() {
    return name().toLowerCase();
  }
}
