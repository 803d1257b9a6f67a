package senatesim.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central dispatcher for one debate.
 *
 * <p>Handlers for an event type are invoked one after another on the publishing
 * thread, highest priority first; ties keep subscription order. A handler that
 * throws is logged and skipped, the remaining handlers still run. Publishing from
 * inside a handler is allowed and dispatches the nested event before returning.
 *
 * <p>Not safe for concurrent {@link #publish} calls. Run independent debates on
 * separate instances.
 */
public class EventBus {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  public static final int DEFAULT_MAX_HISTORY = 100;

  private final int maxHistory;
  private final Map<EventType, List<Subscription>> subscribers = new EnumMap<>(EventType.class);
  private final Deque<Event> history = new ArrayDeque<>();
  private final Map<String, Event> historyById = new HashMap<>();
  private final Set<String> flagged = new HashSet<>();
  private long handlerFailures = 0L;

  public EventBus() {
    this(DEFAULT_MAX_HISTORY);
  }

  public EventBus(int maxHistory) {
    if (maxHistory < 1) {
      throw new IllegalArgumentException("maxHistory must be at least 1: " + maxHistory);
    }
    this.maxHistory = maxHistory;
  }

  public void subscribe(EventType type, EventHandler handler) {
    if (handler == null) throw new IllegalArgumentException("handler must not be null");
    subscribe(type, handler, handler.priority());
  }

  /**
   * Registers {@code handler} for {@code type} with an explicit priority. Subscribing a
   * handler that is already registered for the type is a no-op.
   */
  public void subscribe(EventType type, EventHandler handler, int priority) {
    if (type == null) throw new IllegalArgumentException("type must not be null");
    if (handler == null) throw new IllegalArgumentException("handler must not be null");
    List<Subscription> list = subscribers.computeIfAbsent(type, ignored -> new ArrayList<>());
    for (Subscription s : list) {
      if (s.handler == handler) return;
    }
    // insert after every subscription with priority >= ours so ties keep arrival order
    int index = list.size();
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).priority < priority) {
        index = i;
        break;
      }
    }
    list.add(index, new Subscription(handler, priority));
    log.debug("Subscribed {} to {} at priority {}", handler.handlerName(), type, priority);
  }

  public void unsubscribe(EventType type, EventHandler handler) {
    if (type == null || handler == null) return;
    List<Subscription> list = subscribers.get(type);
    if (list == null) return;
    list.removeIf(s -> s.handler == handler);
    if (list.isEmpty()) subscribers.remove(type);
  }

  /**
   * Records {@code event} in history and delivers it to every handler subscribed to its
   * type. Returns once all handlers have returned.
   */
  public void publish(Event event) {
    if (event == null) throw new IllegalArgumentException("event must not be null");
    checkReference(event);
    append(event);

    List<Subscription> targets = List.copyOf(subscribers.getOrDefault(event.type(), List.of()));
    for (Subscription s : targets) {
      try {
        s.handler.onEvent(event);
      } catch (Exception e) {
        handlerFailures++;
        log.warn("Handler failed: handler={} eventId={} eventType={} error={}",
            s.handler.handlerName(), event.id(), event.type(), e.toString(), e);
      }
    }
  }

  /** Most recent {@code count} events, newest last. */
  public List<Event> getRecentEvents(int count) {
    if (count <= 0 || history.isEmpty()) return List.of();
    List<Event> all = new ArrayList<>(history);
    return Collections.unmodifiableList(all.subList(Math.max(0, all.size() - count), all.size()));
  }

  public List<Event> getHistory() {
    return List.copyOf(history);
  }

  public void clearHistory() {
    history.clear();
    historyById.clear();
    flagged.clear();
  }

  public boolean isInHistory(String eventId) {
    return eventId != null && historyById.containsKey(eventId);
  }

  /** True if the event referenced something other than a speech in history when published. */
  public boolean isFlagged(String eventId) {
    return eventId != null && flagged.contains(eventId);
  }

  public int historySize() { return history.size(); }
  public int maxHistory() { return maxHistory; }
  public long handlerFailureCount() { return handlerFailures; }

  public int subscriberCount(EventType type) {
    List<Subscription> list = subscribers.get(type);
    return list == null ? 0 : list.size();
  }

  private void append(Event event) {
    history.addLast(event);
    historyById.put(event.id(), event);
    while (history.size() > maxHistory) {
      Event evicted = history.removeFirst();
      historyById.remove(evicted.id());
      flagged.remove(evicted.id());
    }
  }

  private void checkReference(Event event) {
    String referenced;
    switch (event.type()) {
      case REACTION -> referenced = ((ReactionEvent) event).targetEventId();
      case INTERJECTION -> referenced = ((InterjectionEvent) event).targetSpeechId();
      default -> {
        return;
      }
    }
    Event target = referenced == null ? null : historyById.get(referenced);
    if (target == null) {
      flagged.add(event.id());
      log.warn("Orphan reference: eventId={} eventType={} references unknown event {}",
          event.id(), event.type(), referenced);
    } else if (target.type() != EventType.SPEECH) {
      flagged.add(event.id());
      log.warn("Orphan reference: eventId={} eventType={} references {} event {}, not a speech",
          event.id(), event.type(), target.type(), referenced);
    }
  }

  private static final class Subscription {
    private final EventHandler handler;
    private final int priority;

    private Subscription(EventHandler handler, int priority) {
      this.handler = handler;
      this.priority = priority;
    }
  }
}
