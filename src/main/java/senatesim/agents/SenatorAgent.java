package senatesim.agents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.debate.DebateListener;
import senatesim.domain.InterjectionType;
import senatesim.domain.ReactionType;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.DebateEvent;
import senatesim.events.Event;
import senatesim.events.EventBus;
import senatesim.events.EventType;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;
import senatesim.memory.AgentMemory;

import java.util.Map;
import java.util.Random;

/**
 * SenatorAgent listens to the debate on an {@link EventBus} and decides, speech by speech,
 * whether to react, whether to interject and whether to shift its stance.
 *
 * <p>For each speech by another senator the agent records it, then runs the reaction,
 * interjection and stance-change steps in that order. Each step draws from the injected
 * {@link Random}, so a fixed seed replays the same decisions. A failure inside one step is
 * logged and that step is skipped for this speech.
 */
public class SenatorAgent extends Agent {
  private static final Logger log = LoggerFactory.getLogger(SenatorAgent.class);

  private static final double AGREEMENT_IMPACT = 0.05;
  private static final double DISAGREEMENT_IMPACT = -0.05;
  private static final double SUPPORT_IMPACT = 0.1;
  private static final double CHALLENGE_IMPACT = -0.1;
  private static final double EMOTIONAL_IMPACT = -0.2;

  private final EventBus bus;
  private final Random rng;
  private final DecisionModel model;
  private final StancePolicy stancePolicy;
  private final ReactionTemplates templates = new ReactionTemplates();
  private DebateListener listener = DebateListener.NONE;

  private AgentState state = AgentState.IDLE;
  private String activeTopic;
  private Senator currentSpeaker;
  private boolean debateInProgress;

  public SenatorAgent(Senator senator, EventBus bus, Random rng) {
    this(senator, new AgentMemory(senator == null ? "" : senator.name()), bus, rng,
        new DecisionModel(DecisionWeights.defaults()), StancePolicy.neutral());
  }

  public SenatorAgent(Senator senator, AgentMemory memory, EventBus bus, Random rng,
                      DecisionModel model, StancePolicy stancePolicy) {
    super(senator, memory);
    if (bus == null) throw new IllegalArgumentException("bus must not be null");
    this.bus = bus;
    this.rng = rng == null ? new Random() : rng;
    this.model = model == null ? new DecisionModel(DecisionWeights.defaults()) : model;
    this.stancePolicy = stancePolicy == null ? StancePolicy.neutral() : stancePolicy;
  }

  /** Registers for speech and debate events at this senator's rank. */
  public SenatorAgent subscribe() {
    bus.subscribe(EventType.SPEECH, this);
    bus.subscribe(EventType.DEBATE, this);
    log.debug("Senator {} subscribed to events", name());
    return this;
  }

  public void unsubscribe() {
    bus.unsubscribe(EventType.SPEECH, this);
    bus.unsubscribe(EventType.DEBATE, this);
  }

  public void setListener(DebateListener listener) {
    this.listener = listener == null ? DebateListener.NONE : listener;
  }

  public AgentState state() { return state; }
  public String activeTopic() { return activeTopic; }
  public Senator currentSpeaker() { return currentSpeaker; }
  public boolean debateInProgress() { return debateInProgress; }

  /** Stance held on the active topic, or null outside a debate or before one is assigned. */
  public Stance currentStance() {
    return activeTopic == null ? null : memory.currentStance(activeTopic);
  }

  public Stance stanceOn(String topic) {
    return memory.currentStance(topic);
  }

  /**
   * Fixes this senator's stance on {@code topic}. A first assignment anchors the stance trace;
   * a later, different assignment is recorded as a stance change.
   */
  public void assignStance(String topic, Stance stance) {
    if (topic == null || stance == null) return;
    Stance held = memory.currentStance(topic);
    if (held == null) {
      memory.recordAssignedStance(topic, stance);
    } else if (held != stance) {
      memory.recordStanceChange(topic, held, stance, "Reassigned", null);
    }
  }

  @Override
  public void onEvent(Event event) {
    switch (event.type()) {
      case SPEECH -> handleSpeech((SpeechEvent) event);
      case DEBATE -> handleDebate((DebateEvent) event);
      case REACTION, INTERJECTION -> log.debug("{} ignores {}", name(), event.type());
    }
  }

  void handleSpeech(SpeechEvent speech) {
    Senator speaker = speech.speaker();
    if (senator.sameSenatorAs(speaker)) {
      if (state == AgentState.SPEAKING) state = AgentState.OBSERVING;
      return;
    }
    if (state != AgentState.OBSERVING) {
      log.debug("{} is {} and ignores speech {}", name(), state, speech.id());
      return;
    }

    guarded("record", speech, () -> {
      memory.recordEvent(speech);
      memory.recordInteraction(speaker.name(), "heard_speech", Map.of(
          "topic", speech.topic() == null ? "" : speech.topic(),
          "stance", speech.stance().label(),
          "speech_id", speech.speechId()));
    });
    guarded("reaction", speech, () -> considerReaction(speech));
    guarded("interjection", speech, () -> considerInterjection(speech));
    guarded("stance", speech, () -> considerStanceChange(speech));
  }

  void handleDebate(DebateEvent event) {
    memory.recordEvent(event);
    switch (event.debateEventType()) {
      case DEBATE_START -> {
        debateInProgress = true;
        activeTopic = event.topic();
        currentSpeaker = null;
        state = AgentState.OBSERVING;
        ensureStance(activeTopic);
        log.debug("Senator {} noticed debate start on {}", name(), activeTopic);
      }
      case SPEAKER_CHANGE -> {
        currentSpeaker = event.speaker();
        if (debateInProgress) {
          state = senator.sameSenatorAs(currentSpeaker) ? AgentState.SPEAKING : AgentState.OBSERVING;
        }
        log.debug("Senator {} noticed speaker change to {}", name(), event.metadata().get("speaker_name"));
      }
      case TOPIC_CHANGE -> {
        activeTopic = event.topic();
        ensureStance(activeTopic);
      }
      case DEBATE_END -> {
        debateInProgress = false;
        activeTopic = null;
        currentSpeaker = null;
        state = AgentState.IDLE;
        log.debug("Senator {} noticed debate end", name());
      }
    }
  }

  private void considerReaction(SpeechEvent speech) {
    Senator speaker = speech.speaker();
    double relationship = memory.relationshipScore(speaker.name());
    double interest = model.topicInterest(rng);
    double probability = model.reactionProbability(relationship, senator.sameFactionAs(speaker), interest);
    if (rng.nextDouble() >= probability) return;

    ReactionType type = model.chooseReactionType(relationship, agreesWith(speech), rng);
    String content = templates.reaction(type, speaker.name(), rng);
    bus.publish(new ReactionEvent(senator, speech, type, content));
    memory.recordReaction(speech.id(), type, content);
    log.debug("Senator {} reacted to speech with {}", name(), type);

    double impact = switch (type) {
      case AGREEMENT -> AGREEMENT_IMPACT;
      case DISAGREEMENT -> DISAGREEMENT_IMPACT;
      default -> 0.0;
    };
    if (impact != 0.0) {
      memory.recordRelationshipImpact(speaker.name(), speech.id(), impact, "Reaction to speech: " + type.label());
    }
  }

  private void considerInterjection(SpeechEvent speech) {
    Senator speaker = speech.speaker();
    double relationship = memory.relationshipScore(speaker.name());
    Stance held = currentStance();
    boolean stanceDiffers = held != null && held != speech.stance();
    double probability = model.interjectionProbability(relationship, senator.rank(), stanceDiffers);
    if (rng.nextDouble() >= probability) return;

    boolean outOfOrder = currentSpeaker != null && !currentSpeaker.sameSenatorAs(speaker);
    InterjectionType type = model.chooseInterjectionType(relationship, agreesWith(speech), senator.rank(),
        outOfOrder, rng);
    ReactionTemplates.Phrase phrase = templates.interjection(type, speaker.name(), rng);
    InterjectionEvent interjection = new InterjectionEvent(senator, speaker, type,
        phrase.latin(), phrase.english(), speech.speechId());
    bus.publish(interjection);
    memory.recordEvent(interjection);
    log.debug("Senator {} interjected during {}'s speech", name(), speaker.name());

    double impact = switch (type) {
      case SUPPORT -> SUPPORT_IMPACT;
      case CHALLENGE -> CHALLENGE_IMPACT;
      case EMOTIONAL -> EMOTIONAL_IMPACT;
      case PROCEDURAL, INFORMATIONAL -> 0.0;
    };
    if (impact != 0.0) {
      memory.recordRelationshipImpact(speaker.name(), speech.id(), impact,
          "Interjection during speech: " + type.label());
    }
  }

  private void considerStanceChange(SpeechEvent speech) {
    Stance oldStance = currentStance();
    if (oldStance == null || activeTopic == null || !activeTopic.equals(speech.topic())) return;

    Senator speaker = speech.speaker();
    double relationship = memory.relationshipScore(speaker.name());
    double probability = model.stanceChangeProbability(relationship, senator.sameFactionAs(speaker), speaker.rank());
    if (rng.nextDouble() >= probability) return;

    Stance newStance;
    if (oldStance == Stance.NEUTRAL) {
      newStance = speech.stance();
    } else if (oldStance != speech.stance()) {
      newStance = Stance.NEUTRAL;
    } else {
      return;
    }
    if (newStance == oldStance) return;

    String reason = "Persuaded by " + speaker.name() + "'s speech";
    memory.recordStanceChange(activeTopic, oldStance, newStance, reason, speech.id());
    listener.onStanceChange(senator, activeTopic, oldStance, newStance, reason);
    log.info("Senator {} changed stance on {} from {} to {} due to {}'s speech",
        name(), activeTopic, oldStance.label(), newStance.label(), speaker.name());
  }

  private boolean agreesWith(SpeechEvent speech) {
    Stance held = currentStance();
    return held != null && held == speech.stance();
  }

  private void ensureStance(String topic) {
    if (topic == null || memory.currentStance(topic) != null) return;
    Stance initial = stancePolicy.initialStance(senator, topic);
    memory.recordAssignedStance(topic, initial == null ? Stance.NEUTRAL : initial);
  }

  private void guarded(String step, SpeechEvent speech, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      log.warn("Senator {} skipped {} for speech {}: {}", name(), step, speech.id(), e.toString(), e);
    }
  }
}
