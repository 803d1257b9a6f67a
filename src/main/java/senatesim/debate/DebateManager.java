package senatesim.debate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.events.DebateEvent;
import senatesim.events.Event;
import senatesim.events.EventBus;
import senatesim.events.EventHandler;
import senatesim.events.EventType;
import senatesim.events.InterjectionEvent;
import senatesim.events.ReactionEvent;
import senatesim.events.SpeechEvent;
import senatesim.speech.SpeechContent;
import senatesim.speech.SpeechGenerationException;
import senatesim.speech.SpeechGenerator;
import senatesim.speech.SpeechRecord;
import senatesim.speech.SpeechRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Presides over one debate at a time: opens and closes it, hands out the floor, publishes
 * speeches and rules on interjections by rank.
 *
 * <p>Calls that do not fit the current state (starting twice, ending or changing topic with no
 * debate open) are logged and reported through the return value rather than thrown.
 */
public class DebateManager implements EventHandler {
  private static final Logger log = LoggerFactory.getLogger(DebateManager.class);

  /** Rulings run ahead of every senator subscribed to the same event type. */
  public static final int PRESIDING_PRIORITY = 1000;

  private final EventBus bus;
  private final SpeechGenerator generator;
  private final DebateListener listener;
  private final Duration speechPause;
  private BiFunction<Senator, String, Stance> stanceHints = (senator, topic) -> null;

  private DebateState state = DebateState.NOT_STARTED;
  private String topic;
  private Senator currentSpeaker;
  private Instant startedAt;
  private final Deque<Senator> queue = new ArrayDeque<>();
  private final List<Senator> participants = new ArrayList<>();
  private final List<SpeechRecord> speeches = new ArrayList<>();
  private final Map<String, Integer> speechesBySpeaker = new LinkedHashMap<>();
  private final List<ArbitrationRecord> arbitrations = new ArrayList<>();
  private final List<ReactionEvent> reactions = new ArrayList<>();

  public DebateManager(EventBus bus, SpeechGenerator generator, DebateListener listener) {
    this(bus, generator, listener, Duration.ZERO);
  }

  public DebateManager(EventBus bus, SpeechGenerator generator, DebateListener listener, Duration speechPause) {
    if (bus == null) throw new IllegalArgumentException("bus must not be null");
    this.bus = bus;
    this.generator = generator;
    this.listener = listener == null ? DebateListener.NONE : listener;
    this.speechPause = speechPause == null || speechPause.isNegative() ? Duration.ZERO : speechPause;
    bus.subscribe(EventType.INTERJECTION, this, PRESIDING_PRIORITY);
    bus.subscribe(EventType.REACTION, this, PRESIDING_PRIORITY);
  }

  /** Supplies the stance hint passed to the generator for each speaker; may return null. */
  public void setStanceHints(BiFunction<Senator, String, Stance> stanceHints) {
    this.stanceHints = stanceHints == null ? (senator, t) -> null : stanceHints;
  }

  public DebateState state() { return state; }
  public boolean debateInProgress() { return state == DebateState.IN_PROGRESS; }
  public String currentTopic() { return topic; }
  public Senator currentSpeaker() { return currentSpeaker; }
  public List<Senator> pendingSpeakers() { return List.copyOf(queue); }
  public List<Senator> participants() { return List.copyOf(participants); }
  public List<SpeechRecord> speechHistory() { return List.copyOf(speeches); }
  public List<ArbitrationRecord> arbitrationLog() { return List.copyOf(arbitrations); }
  public List<ReactionEvent> reactionLog() { return List.copyOf(reactions); }

  @Override
  public int priority() {
    return PRESIDING_PRIORITY;
  }

  @Override
  public String handlerName() {
    return "DebateManager";
  }

  @Override
  public void onEvent(Event event) {
    switch (event.type()) {
      case INTERJECTION -> handleInterjection((InterjectionEvent) event);
      case REACTION -> handleReaction((ReactionEvent) event);
      case DEBATE, SPEECH -> log.debug("DebateManager ignores {}", event.type());
    }
  }

  /**
   * Opens a debate on {@code topic} with {@code senators} queued to speak in the given order.
   *
   * @return false if a debate is already in progress, in which case nothing changes
   */
  public boolean startDebate(String topic, List<Senator> senators) {
    if (state == DebateState.IN_PROGRESS) {
      log.warn("Cannot start debate on {}: debate on {} already in progress", topic, this.topic);
      return false;
    }
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    resetSession();
    this.topic = topic;
    if (senators != null) {
      for (Senator senator : senators) {
        if (senator != null && !contains(queue, senator)) {
          queue.addLast(senator);
          participants.add(senator);
        }
      }
    }
    startedAt = Instant.now();
    state = DebateState.IN_PROGRESS;

    log.info("[Debate] Debate started on {} with {} senators", topic, participants.size());
    listener.onDebateStarted(topic, List.copyOf(participants));
    bus.publish(DebateEvent.start(topic, participantNames()));
    return true;
  }

  /** Queues {@code senator} to speak unless already queued. */
  public boolean registerSpeaker(Senator senator) {
    if (senator == null) throw new IllegalArgumentException("senator must not be null");
    if (contains(queue, senator)) return false;
    queue.addLast(senator);
    if (!contains(participants, senator)) participants.add(senator);
    return true;
  }

  /**
   * Gives the floor to the next queued senator.
   *
   * @return the new speaker, or null if the queue is empty or no debate is open
   */
  public Senator nextSpeaker() {
    if (state != DebateState.IN_PROGRESS) {
      log.warn("No debate in progress; cannot advance speaker");
      return null;
    }
    Senator next = queue.pollFirst();
    if (next == null) return null;
    giveFloor(next);
    return next;
  }

  /**
   * Publishes a speech. A senator speaking without holding the floor is first given it, so
   * the speaker change always precedes the speech in history.
   */
  public SpeechEvent publishSpeech(Senator speaker, String topic, String content, Stance stance,
                                   List<String> keyPoints) {
    if (speaker == null) throw new IllegalArgumentException("speaker must not be null");
    if (state == DebateState.IN_PROGRESS && !speaker.sameSenatorAs(currentSpeaker)) {
      queue.removeIf(speaker::sameSenatorAs);
      if (!contains(participants, speaker)) participants.add(speaker);
      giveFloor(speaker);
    } else if (state != DebateState.IN_PROGRESS) {
      log.warn("Speech by {} published with no debate in progress", speaker.name());
    }

    SpeechEvent speech = new SpeechEvent(speaker, topic, content, stance, keyPoints);
    if (state == DebateState.IN_PROGRESS) {
      speeches.add(new SpeechRecord(speech.speechId(), speaker, topic, speech.stance(), speech.content(),
          speech.keyPoints()));
      speechesBySpeaker.merge(speaker.name(), 1, Integer::sum);
    }
    log.info("[Floor] {} ({}): {}", speaker.name(), speech.stance().label(), speech.content());
    listener.onSpeech(speech);
    bus.publish(speech);
    return speech;
  }

  /**
   * Rules on an interjection against the senator holding the floor.
   *
   * @return true if the interjection was allowed and surfaced
   */
  public boolean handleInterjection(InterjectionEvent event) {
    if (state != DebateState.IN_PROGRESS || currentSpeaker == null) {
      log.warn("Interjection received but no debate in progress");
      return false;
    }
    boolean allowed = InterruptionRules.isAllowed(event.interjector().rank(), currentSpeaker.rank(),
        event.interjectionType());
    arbitrations.add(new ArbitrationRecord(event, currentSpeaker.name(), allowed, Instant.now()));
    if (allowed) {
      log.info("[Interjection] INTERJECTION: {} ({}) interrupts {}: {} Allowed: true",
          event.interjector().name(), event.interjectionType().label(), currentSpeaker.name(),
          event.englishContent());
      listener.onInterjection(event);
    } else {
      log.debug("[Interjection] INTERJECTION: {} ({}) interrupts {}: {} Allowed: false",
          event.interjector().name(), event.interjectionType().label(), currentSpeaker.name(),
          event.englishContent());
    }
    return allowed;
  }

  public void handleReaction(ReactionEvent event) {
    if (state != DebateState.IN_PROGRESS) {
      log.warn("Reaction received but no debate in progress");
      return;
    }
    reactions.add(event);
    log.debug("[Reaction] {} {}: {}", event.reactor().name(), event.reactionType().label(), event.content());
    listener.onReaction(event);
  }

  /**
   * Switches the open debate to {@code newTopic}.
   *
   * @return false if no debate is in progress
   */
  public boolean changeTopic(String newTopic) {
    if (state != DebateState.IN_PROGRESS) {
      log.warn("Cannot change topic to {}: no debate in progress", newTopic);
      return false;
    }
    if (newTopic == null || newTopic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    String previous = topic;
    topic = newTopic;
    log.info("[Debate] Topic changed from {} to {}", previous, newTopic);
    bus.publish(DebateEvent.topicChange(previous, newTopic));
    return true;
  }

  /**
   * Closes the open debate.
   *
   * @return the closing summary, or null if no debate was in progress
   */
  public DebateSummary endDebate() {
    if (state != DebateState.IN_PROGRESS) {
      log.warn("Cannot end debate: no debate in progress");
      return null;
    }
    DebateSummary summary = summarize();
    bus.publish(DebateEvent.end(topic, participantNames()));
    state = DebateState.ENDED;
    topic = null;
    currentSpeaker = null;
    queue.clear();

    log.info("[Debate] Debate ended on {}: {} speeches, {} interjections ({} allowed), {} reactions",
        summary.topic(), summary.speechCount(), summary.interjectionCount(),
        summary.allowedInterjectionCount(), summary.reactionCount());
    listener.onDebateEnded(summary);
    return summary;
  }

  /**
   * Runs a whole debate: every senator speaks once in turn, then the debate closes. A senator
   * whose speech cannot be generated is skipped.
   *
   * @return the speeches delivered, in order; empty if the debate could not be started
   */
  public List<SpeechRecord> conductDebate(String topic, List<Senator> senators) {
    if (generator == null) throw new IllegalStateException("No speech generator configured");
    if (!startDebate(topic, senators)) return List.of();

    Senator speaker;
    while (state == DebateState.IN_PROGRESS && (speaker = nextSpeaker()) != null) {
      SpeechContent content;
      try {
        content = generator.generate(new SpeechRequest(speaker, this.topic,
            stanceHints.apply(speaker, this.topic), speeches));
        if (content == null || content.isBlank()) {
          throw new SpeechGenerationException("Generator returned no speech for " + speaker.name());
        }
      } catch (SpeechGenerationException | RuntimeException e) {
        log.warn("[Floor] {} could not deliver a speech on {}: {}", speaker.name(), this.topic, e.getMessage(), e);
        listener.onSpeechFailed(speaker, this.topic, e);
        continue;
      }
      publishSpeech(speaker, this.topic, content.text, content.stanceValue(), content.keyPointsView());
      if (!pause()) break;
    }

    List<SpeechRecord> delivered = List.copyOf(speeches);
    if (state == DebateState.IN_PROGRESS) endDebate();
    return delivered;
  }

  private void giveFloor(Senator speaker) {
    currentSpeaker = speaker;
    log.debug("[Debate] {} has the floor", speaker.name());
    bus.publish(DebateEvent.speakerChange(speaker, topic));
  }

  private boolean pause() {
    if (speechPause.isZero()) return true;
    try {
      Thread.sleep(speechPause.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[Debate] Interrupted between speeches; closing debate on {}", topic);
      return false;
    }
  }

  private DebateSummary summarize() {
    String mostActive = null;
    int best = 0;
    for (Map.Entry<String, Integer> entry : speechesBySpeaker.entrySet()) {
      if (entry.getValue() > best) {
        best = entry.getValue();
        mostActive = entry.getKey();
      }
    }
    int allowed = (int) arbitrations.stream().filter(ArbitrationRecord::allowed).count();
    Duration duration = startedAt == null ? Duration.ZERO : Duration.between(startedAt, Instant.now());
    return new DebateSummary(topic, participantNames(), duration, speeches.size(), speechesBySpeaker,
        arbitrations.size(), allowed, reactions.size(), mostActive);
  }

  private void resetSession() {
    queue.clear();
    participants.clear();
    speeches.clear();
    speechesBySpeaker.clear();
    arbitrations.clear();
    reactions.clear();
    currentSpeaker = null;
  }

  private List<String> participantNames() {
    List<String> names = new ArrayList<>(participants.size());
    for (Senator senator : participants) names.add(senator.name());
    return names;
  }

  private static boolean contains(Iterable<Senator> senators, Senator senator) {
    for (Senator s : senators) {
      if (s.sameSenatorAs(senator)) return true;
    }
    return false;
  }
}
