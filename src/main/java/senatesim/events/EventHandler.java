package senatesim.events;

/**
 * Subscriber callback. Identity matters: the bus treats the same handler instance
 * subscribed twice for one type as a single subscription.
 */
@FunctionalInterface
public interface EventHandler {
  void onEvent(Event event) throws Exception;

  /** Dispatch priority used when subscribing without an explicit override. Higher runs first. */
  default int priority() {
    return 0;
  }

  default String handlerName() {
    return getClass().getSimpleName();
  }
}
