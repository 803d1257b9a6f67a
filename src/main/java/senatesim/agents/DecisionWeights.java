package senatesim.agents;

/**
 * Tunable constants behind the reaction, interjection and stance-change formulas.
 * The shape of each formula is fixed in {@link DecisionModel}; only the numbers vary.
 */
public record DecisionWeights(
    double reactionBase,
    double reactionCap,
    double reactionRelationshipWeight,
    double reactionFactionBonus,
    double maxTopicInterest,
    double interjectionBase,
    double interjectionCap,
    double interjectionRelationshipWeight,
    double interjectionRankStep,
    double interjectionRankCap,
    double interjectionStanceBonus,
    double stanceChangeBase,
    double stanceChangeCap,
    double stanceChangeRelationshipWeight,
    double stanceChangeFactionBonus,
    double stanceChangeRankStep,
    double stanceChangeRankCap,
    double strongRelationship
) {
  public DecisionWeights {
    requireProbability("reactionCap", reactionCap);
    requireProbability("interjectionCap", interjectionCap);
    requireProbability("stanceChangeCap", stanceChangeCap);
    if (maxTopicInterest < 0) {
      throw new IllegalArgumentException("maxTopicInterest must be non-negative: " + maxTopicInterest);
    }
  }

  public static DecisionWeights defaults() {
    return new DecisionWeights(
        0.3, 0.8, 0.2, 0.1, 0.3,
        0.1, 0.5, 0.15, 0.05, 0.2, 0.15,
        0.05, 0.3, 0.1, 0.05, 0.025, 0.1,
        0.3
    );
  }

  private static void requireProbability(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be within [0, 1]: " + value);
    }
  }
}
