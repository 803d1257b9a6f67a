package senatesim.agents;

import senatesim.domain.Senator;
import senatesim.events.EventHandler;
import senatesim.memory.AgentMemory;

public abstract class Agent implements EventHandler {
  protected final Senator senator;
  protected final AgentMemory memory;

  protected Agent(Senator senator, AgentMemory memory) {
    if (senator == null) throw new IllegalArgumentException("senator must not be null");
    this.senator = senator;
    this.memory = memory == null ? new AgentMemory(senator.name()) : memory;
  }

  public Senator senator() { return senator; }
  public String id() { return senator.id(); }
  public String name() { return senator.name(); }
  public AgentMemory memory() { return memory; }

  /** Higher-ranked senators hear events first. */
  @Override
  public int priority() {
    return senator.rank();
  }

  @Override
  public String handlerName() {
    return getClass().getSimpleName() + "[" + senator.name() + "]";
  }
}
