package senatesim.agents;

import senatesim.domain.InterjectionType;
import senatesim.domain.ReactionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Probability formulas and weighted choices used by {@link SenatorAgent}.
 *
 * <p>Every probability is clamped to {@code [0, cap]} however large the summed factors get.
 * The model holds no state; randomness always comes from the caller's generator.
 */
public class DecisionModel {
  private static final List<ReactionType> AFFIRMING = List.of(ReactionType.AGREEMENT, ReactionType.INTEREST);
  private static final List<ReactionType> HOSTILE = List.of(ReactionType.DISAGREEMENT, ReactionType.SKEPTICISM);
  private static final ReactionType[] ALL_REACTIONS = ReactionType.values();

  private final DecisionWeights weights;

  public DecisionModel(DecisionWeights weights) {
    this.weights = weights == null ? DecisionWeights.defaults() : weights;
  }

  public DecisionWeights weights() { return weights; }

  /** Random interest in the topic, in {@code [0, maxTopicInterest)}. */
  public double topicInterest(Random rng) {
    return rng.nextDouble() * weights.maxTopicInterest();
  }

  public double reactionProbability(double relationship, boolean sameFaction, double topicInterest) {
    double relationshipFactor = Math.abs(relationship) * weights.reactionRelationshipWeight();
    double factionFactor = 0.0;
    if ((sameFaction && relationship >= 0) || (!sameFaction && relationship < 0)) {
      factionFactor = weights.reactionFactionBonus();
    }
    double sum = weights.reactionBase() + relationshipFactor + factionFactor + topicInterest;
    return capped(sum, weights.reactionCap());
  }

  public double interjectionProbability(double relationship, int rank, boolean stanceDiffers) {
    double relationshipFactor = Math.abs(relationship) * weights.interjectionRelationshipWeight();
    double rankFactor = Math.min(weights.interjectionRankCap(), Math.max(0, rank) * weights.interjectionRankStep());
    double stanceFactor = stanceDiffers ? weights.interjectionStanceBonus() : 0.0;
    double sum = weights.interjectionBase() + relationshipFactor + rankFactor + stanceFactor;
    return capped(sum, weights.interjectionCap());
  }

  public double stanceChangeProbability(double relationship, boolean sameFaction, int speakerRank) {
    double relationshipFactor = Math.max(0.0, relationship) * weights.stanceChangeRelationshipWeight();
    double factionFactor = sameFaction ? weights.stanceChangeFactionBonus() : 0.0;
    double rankFactor = Math.min(weights.stanceChangeRankCap(), Math.max(0, speakerRank) * weights.stanceChangeRankStep());
    double sum = weights.stanceChangeBase() + relationshipFactor + factionFactor + rankFactor;
    return capped(sum, weights.stanceChangeCap());
  }

  public ReactionType chooseReactionType(double relationship, boolean stanceAgrees, Random rng) {
    if (relationship > weights.strongRelationship() && stanceAgrees) {
      return AFFIRMING.get(rng.nextInt(AFFIRMING.size()));
    }
    if (relationship < -weights.strongRelationship() && !stanceAgrees) {
      return HOSTILE.get(rng.nextInt(HOSTILE.size()));
    }
    return ALL_REACTIONS[rng.nextInt(ALL_REACTIONS.length)];
  }

  /**
   * Picks an interjection type. An inferred breach of order always yields a procedural
   * interjection; otherwise the choice is weighted by relationship polarity, stance
   * agreement and the interjector's own rank.
   */
  public InterjectionType chooseInterjectionType(double relationship, boolean stanceAgrees, int rank,
                                                 boolean orderViolation, Random rng) {
    if (orderViolation) return InterjectionType.PROCEDURAL;
    return weightedChoice(interjectionWeights(relationship, stanceAgrees, rank), rng);
  }

  Map<InterjectionType, Double> interjectionWeights(double relationship, boolean stanceAgrees, int rank) {
    boolean senior = rank > 2;
    Map<InterjectionType, Double> w = new EnumMap<>(InterjectionType.class);
    if (relationship > weights.strongRelationship()) {
      w.put(InterjectionType.SUPPORT, 0.5);
      w.put(InterjectionType.INFORMATIONAL, 0.3);
      w.put(InterjectionType.CHALLENGE, 0.1);
      w.put(InterjectionType.PROCEDURAL, senior ? 0.1 : 0.0);
      w.put(InterjectionType.EMOTIONAL, 0.0);
    } else if (relationship < -weights.strongRelationship()) {
      w.put(InterjectionType.CHALLENGE, 0.5);
      w.put(InterjectionType.EMOTIONAL, 0.2);
      w.put(InterjectionType.PROCEDURAL, senior ? 0.2 : 0.1);
      w.put(InterjectionType.INFORMATIONAL, 0.1);
      w.put(InterjectionType.SUPPORT, 0.0);
    } else {
      w.put(InterjectionType.INFORMATIONAL, 0.3);
      w.put(InterjectionType.CHALLENGE, stanceAgrees ? 0.1 : 0.2);
      w.put(InterjectionType.SUPPORT, stanceAgrees ? 0.2 : 0.1);
      w.put(InterjectionType.PROCEDURAL, senior ? 0.2 : 0.1);
      w.put(InterjectionType.EMOTIONAL, 0.1);
    }
    return w;
  }

  private static InterjectionType weightedChoice(Map<InterjectionType, Double> w, Random rng) {
    double total = 0.0;
    for (double value : w.values()) total += value;
    double roll = rng.nextDouble() * total;
    InterjectionType last = null;
    for (Map.Entry<InterjectionType, Double> entry : w.entrySet()) {
      if (entry.getValue() <= 0.0) continue;
      last = entry.getKey();
      roll -= entry.getValue();
      if (roll < 0.0) return entry.getKey();
    }
    return last == null ? InterjectionType.INFORMATIONAL : last;
  }

  private static double capped(double value, double cap) {
    if (Double.isNaN(value)) return 0.0;
    return Math.max(0.0, Math.min(cap, value));
  }
}
