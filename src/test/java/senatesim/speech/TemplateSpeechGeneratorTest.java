package senatesim.speech;

import org.junit.jupiter.api.Test;
import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateSpeechGeneratorTest {

  private final Senator cato = new Senator("cato", "Cato", "Optimates", 4);
  private final Senator caesar = new Senator("caesar", "Caesar", "Populares", 4);

  @Test
  void stanceHint_isHonoured() throws Exception {
    TemplateSpeechGenerator generator = new TemplateSpeechGenerator(new Random(3));

    SpeechContent content = generator.generate(new SpeechRequest(cato, "Land Reform", Stance.OPPOSE, List.of()));

    assertThat(content.stanceValue()).isEqualTo(Stance.OPPOSE);
    assertThat(content.text).contains("Land Reform").contains("the traditions of our ancestors");
    assertThat(content.keyPointsView()).hasSize(2);
  }

  @Test
  void sameSeed_producesSameSpeech() throws Exception {
    SpeechRequest request = new SpeechRequest(caesar, "Land Reform", null, List.of());

    SpeechContent a = new TemplateSpeechGenerator(new Random(9)).generate(request);
    SpeechContent b = new TemplateSpeechGenerator(new Random(9)).generate(request);

    assertThat(a.text).isEqualTo(b.text);
    assertThat(a.stanceValue()).isEqualTo(b.stanceValue());
  }

  @Test
  void priorSpeech_isAnswered() throws Exception {
    SpeechRecord earlier = new SpeechRecord("s1", cato, "Land Reform", Stance.OPPOSE, "No.", List.of());
    TemplateSpeechGenerator generator = new TemplateSpeechGenerator(new Random(3));

    SpeechContent content = generator.generate(new SpeechRequest(caesar, "Land Reform", Stance.SUPPORT, List.of(earlier)));

    assertThat(content.text).contains("I cannot accept what Cato has argued.");
    assertThat(content.keyPointsView()).contains("Answers Cato");
  }

  @Test
  void missingTopic_fails() {
    TemplateSpeechGenerator generator = new TemplateSpeechGenerator(new Random(3));

    assertThatThrownBy(() -> generator.generate(new SpeechRequest(cato, " ", null, List.of())))
        .isInstanceOf(SpeechGenerationException.class);
  }
}
