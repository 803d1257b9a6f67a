package senatesim.speech;

import senatesim.domain.Senator;

import java.util.List;
import java.util.stream.Collectors;

public class SpeechPromptBuilder {
  private static final int MAX_PRIOR_SPEECHES = 6;
  private static final int MAX_EXCERPT_CHARS = 240;

  public String buildSpeechPrompt(SpeechRequest request) {
    Senator speaker = request.speaker();
    String stanceHint = request.stanceHint() == null ? "(choose your own)" : request.stanceHint().label();
    return """
You are %s, a senator addressing the assembly.

PERSONA:
- Faction: %s
- Rank: %d

TOPIC:
%s

YOUR CURRENT STANCE:
%s

PRIOR SPEECHES (oldest first):
%s

Return STRICT JSON with keys:
text (string), stance ("support"|"oppose"|"neutral"), keyPoints (array of strings).
Arrays must contain only strings, not objects.
Keep text 80-150 words. keyPoints must have 2-4 items, each one sentence.
When relevant, answer earlier speakers by name.
No extra keys. No markdown.
""".formatted(speaker.name(), factionOrNone(speaker), speaker.rank(),
        request.topic(), stanceHint, priorSpeeches(request.priorSpeeches()));
  }

  public String buildRetryPrompt(String prompt) {
    return prompt + "\nReturn compact JSON only. No extra text.";
  }

  private static String factionOrNone(Senator speaker) {
    return speaker.faction().isBlank() ? "(none)" : speaker.faction();
  }

  private static String priorSpeeches(List<SpeechRecord> prior) {
    if (prior.isEmpty()) return "(none)";
    int start = Math.max(0, prior.size() - MAX_PRIOR_SPEECHES);
    return prior.subList(start, prior.size()).stream()
        .map(r -> "- " + r.speaker().name() + " (" + r.stance().label() + "): " + excerpt(r.content()))
        .collect(Collectors.joining("\n"));
  }

  private static String excerpt(String text) {
    if (text == null) return "";
    String flat = text.replaceAll("\\s+", " ").trim();
    return flat.length() <= MAX_EXCERPT_CHARS ? flat : flat.substring(0, MAX_EXCERPT_CHARS) + "...";
  }
}
