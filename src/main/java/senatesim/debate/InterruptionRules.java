package senatesim.debate;

import senatesim.domain.InterjectionType;

/**
 * Who may interrupt whom. A senator may interrupt anyone of lower rank; between equals only
 * a point of order is heard.
 */
public final class InterruptionRules {
  private InterruptionRules() {}

  public static boolean isAllowed(int interjectorRank, int speakerRank, InterjectionType type) {
    if (interjectorRank > speakerRank) return true;
    return interjectorRank == speakerRank && type == InterjectionType.PROCEDURAL;
  }
}
