package senatesim.agents;

import senatesim.domain.InterjectionType;
import senatesim.domain.ReactionType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Canned wording for reactions and interjections. Placeholders {@code {speaker}} are
 * replaced with the name of the senator holding the floor.
 */
public class ReactionTemplates {
  public record Phrase(String latin, String english) {}

  private static final Map<ReactionType, List<String>> REACTIONS = new EnumMap<>(ReactionType.class);
  private static final Map<InterjectionType, List<Phrase>> INTERJECTIONS = new EnumMap<>(InterjectionType.class);

  static {
    REACTIONS.put(ReactionType.AGREEMENT, List.of(
        "Nods in agreement with {speaker}",
        "Gestures supportively toward {speaker}",
        "Quietly says 'Bene dictum'"));
    REACTIONS.put(ReactionType.DISAGREEMENT, List.of(
        "Frowns at {speaker}'s points",
        "Shakes head in disagreement",
        "Mutters quietly in disagreement"));
    REACTIONS.put(ReactionType.INTEREST, List.of(
        "Leans forward with interest",
        "Listens attentively to {speaker}",
        "Takes mental notes on {speaker}'s arguments"));
    REACTIONS.put(ReactionType.BOREDOM, List.of(
        "Stifles a yawn",
        "Looks disinterested",
        "Glances around the chamber"));
    REACTIONS.put(ReactionType.SKEPTICISM, List.of(
        "Raises an eyebrow skeptically",
        "Looks unconvinced by {speaker}'s arguments",
        "Exchanges skeptical glances with nearby senators"));
    REACTIONS.put(ReactionType.NEUTRAL, List.of(
        "Maintains a neutral expression",
        "Listens without visible reaction",
        "Considers the arguments carefully"));

    INTERJECTIONS.put(InterjectionType.SUPPORT, List.of(
        new Phrase("Assentior!", "I strongly support {speaker}'s position!"),
        new Phrase("Bene dictum!", "Hear, hear!"),
        new Phrase("Recte dicis!", "Well said, colleague!")));
    INTERJECTIONS.put(InterjectionType.CHALLENGE, List.of(
        new Phrase("Nego!", "I must challenge {speaker}'s assertion!"),
        new Phrase("Falsum est!", "That claim is unfounded!"),
        new Phrase("Ubi probatio?", "Where is your evidence for this?")));
    INTERJECTIONS.put(InterjectionType.PROCEDURAL, List.of(
        new Phrase("Ad ordinem!", "Point of order!"),
        new Phrase("Tempus exhaustum est!", "The speaker is out of time!"),
        new Phrase("Non recte procedit!", "This matter is not properly before the Senate!")));
    INTERJECTIONS.put(InterjectionType.EMOTIONAL, List.of(
        new Phrase("Infandum!", "Outrageous!"),
        new Phrase("Absurdum!", "Absurd!"),
        new Phrase("Quomodo audes!", "How dare you suggest such a thing!")));
    INTERJECTIONS.put(InterjectionType.INFORMATIONAL, List.of(
        new Phrase("Si licet addere...", "If I may add a relevant fact..."),
        new Phrase("Senator praetermisit...", "The senator has overlooked an important detail."),
        new Phrase("Rem gravem explicabo.", "Let me clarify an important point.")));
  }

  public String reaction(ReactionType type, String speakerName, Random rng) {
    List<String> options = REACTIONS.getOrDefault(type, REACTIONS.get(ReactionType.NEUTRAL));
    return fill(options.get(rng.nextInt(options.size())), speakerName);
  }

  public Phrase interjection(InterjectionType type, String speakerName, Random rng) {
    List<Phrase> options = INTERJECTIONS.get(type);
    if (options == null || options.isEmpty()) {
      return new Phrase("Interrumpo!", "I interject!");
    }
    Phrase chosen = options.get(rng.nextInt(options.size()));
    return new Phrase(fill(chosen.latin(), speakerName), fill(chosen.english(), speakerName));
  }

  private static String fill(String template, String speakerName) {
    String name = speakerName == null || speakerName.isBlank() ? "the speaker" : speakerName;
    return template.replace("{speaker}", name);
  }
}
