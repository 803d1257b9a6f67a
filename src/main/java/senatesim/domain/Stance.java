package senatesim.domain;

public enum Stance {
  SUPPORT,
  OPPOSE,
  NEUTRAL;

  public String label() {
    return name().toLowerCase();
  }

  /**
   * Lenient parse of free-form stance labels. Unknown or blank input yields null.
   */
  public static Stance fromLabel(String raw) {
    if (raw == null || raw.isBlank()) return null;
    return switch (raw.trim().toLowerCase()) {
      case "support", "for", "yes", "pro" -> SUPPORT;
      case "oppose", "against", "no", "con" -> OPPOSE;
      case "neutral", "undecided", "abstain" -> NEUTRAL;
      default -> null;
    };
  }
}
