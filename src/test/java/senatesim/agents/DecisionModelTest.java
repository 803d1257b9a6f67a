package senatesim.agents;

import org.junit.jupiter.api.Test;
import senatesim.domain.InterjectionType;
import senatesim.domain.ReactionType;

import java.util.EnumSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DecisionModelTest {

  private final DecisionModel model = new DecisionModel(DecisionWeights.defaults());

  @Test
  void reactionProbability_followsFormula() {
    // 0.3 + |0.5| * 0.2 + 0.1 (same faction, rel >= 0) + 0.1
    assertThat(model.reactionProbability(0.5, true, 0.1)).isCloseTo(0.6, within(1e-9));
    // different faction, negative relationship also earns the faction factor
    assertThat(model.reactionProbability(-0.5, false, 0.0)).isCloseTo(0.5, within(1e-9));
    // different faction, positive relationship does not
    assertThat(model.reactionProbability(0.5, false, 0.0)).isCloseTo(0.4, within(1e-9));
  }

  @Test
  void interjectionProbability_followsFormula() {
    // 0.1 + 0.2 * 0.15 + min(0.2, 2 * 0.05) + 0.15
    assertThat(model.interjectionProbability(0.2, 2, true)).isCloseTo(0.38, within(1e-9));
    assertThat(model.interjectionProbability(0.0, 0, false)).isCloseTo(0.1, within(1e-9));
  }

  @Test
  void stanceChangeProbability_followsFormula() {
    // 0.05 + 0.5 * 0.1 + 0.05 + min(0.1, 2 * 0.025)
    assertThat(model.stanceChangeProbability(0.5, true, 2)).isCloseTo(0.2, within(1e-9));
    // negative relationship contributes nothing
    assertThat(model.stanceChangeProbability(-1.0, false, 0)).isCloseTo(0.05, within(1e-9));
  }

  @Test
  void probabilities_stayWithinCapsForExtremeInputs() {
    double[] relationships = {-1e9, -1.0, -0.3, 0.0, 0.3, 1.0, 1e9, Double.NaN};
    int[] ranks = {0, 1, 4, 100, Integer.MAX_VALUE};
    for (double rel : relationships) {
      for (int rank : ranks) {
        for (boolean flag : new boolean[] {true, false}) {
          assertThat(model.reactionProbability(rel, flag, 1e6)).isBetween(0.0, 0.8);
          assertThat(model.reactionProbability(rel, flag, -1e6)).isBetween(0.0, 0.8);
          assertThat(model.interjectionProbability(rel, rank, flag)).isBetween(0.0, 0.5);
          assertThat(model.stanceChangeProbability(rel, flag, rank)).isBetween(0.0, 0.3);
        }
      }
    }
  }

  @Test
  void fixedSeed_reactionProbabilityIsReproducible() {
    double first = model.reactionProbability(0.9, true, model.topicInterest(new Random(7)));
    double second = model.reactionProbability(0.9, true, model.topicInterest(new Random(7)));
    double expected = Math.min(0.8, 0.3 + 0.9 * 0.2 + 0.1 + new Random(7).nextDouble() * 0.3);

    assertThat(first).isEqualTo(second);
    assertThat(first).isCloseTo(expected, within(1e-12));
    assertThat(first).isBetween(0.58, 0.8);
  }

  @Test
  void strongPositiveAgreement_choosesAgreementOrInterest() {
    Random rng = new Random(11);
    Set<ReactionType> seen = EnumSet.noneOf(ReactionType.class);
    for (int i = 0; i < 200; i++) {
      seen.add(model.chooseReactionType(0.9, true, rng));
    }
    assertThat(seen).containsExactlyInAnyOrder(ReactionType.AGREEMENT, ReactionType.INTEREST);
  }

  @Test
  void strongNegativeDisagreement_choosesDisagreementOrSkepticism() {
    Random rng = new Random(11);
    Set<ReactionType> seen = EnumSet.noneOf(ReactionType.class);
    for (int i = 0; i < 200; i++) {
      seen.add(model.chooseReactionType(-0.9, false, rng));
    }
    assertThat(seen).containsExactlyInAnyOrder(ReactionType.DISAGREEMENT, ReactionType.SKEPTICISM);
  }

  @Test
  void mixedSignals_canChooseAnyReaction() {
    Random rng = new Random(3);
    Set<ReactionType> seen = EnumSet.noneOf(ReactionType.class);
    for (int i = 0; i < 500; i++) {
      seen.add(model.chooseReactionType(0.9, false, rng));
    }
    assertThat(seen).containsExactlyInAnyOrder(ReactionType.values());
  }

  @Test
  void orderViolation_alwaysYieldsProcedural() {
    Random rng = new Random(5);
    for (int i = 0; i < 50; i++) {
      assertThat(model.chooseInterjectionType(0.9, true, 0, true, rng)).isEqualTo(InterjectionType.PROCEDURAL);
    }
  }

  @Test
  void hostileRelationship_neverYieldsSupport() {
    Random rng = new Random(5);
    for (int i = 0; i < 300; i++) {
      assertThat(model.chooseInterjectionType(-0.8, false, 1, false, rng)).isNotEqualTo(InterjectionType.SUPPORT);
    }
  }

  @Test
  void friendlyRelationship_neverYieldsEmotional() {
    Random rng = new Random(5);
    for (int i = 0; i < 300; i++) {
      assertThat(model.chooseInterjectionType(0.8, true, 1, false, rng)).isNotEqualTo(InterjectionType.EMOTIONAL);
    }
  }

  @Test
  void interjectionWeights_favourProceduralForSeniors() {
    Map<InterjectionType, Double> junior = model.interjectionWeights(0.0, false, 1);
    Map<InterjectionType, Double> senior = model.interjectionWeights(0.0, false, 3);

    assertThat(senior.get(InterjectionType.PROCEDURAL)).isGreaterThan(junior.get(InterjectionType.PROCEDURAL));
    assertThat(junior.get(InterjectionType.CHALLENGE)).isGreaterThan(junior.get(InterjectionType.SUPPORT));
  }

  @Test
  void weights_rejectCapsOutsideUnitInterval() {
    assertThatThrownBy(() -> new DecisionWeights(0.3, 1.5, 0.2, 0.1, 0.3, 0.1, 0.5, 0.15, 0.05, 0.2, 0.15,
        0.05, 0.3, 0.1, 0.05, 0.025, 0.1, 0.3)).isInstanceOf(IllegalArgumentException.class);
  }
}
