package senatesim.domain;

import java.util.Objects;

/**
 * A member of the assembly. Rank drives both dispatch priority on the event bus
 * and who may interrupt whom during a debate.
 */
public record Senator(String id, String name, String faction, int rank) {
  public Senator {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    faction = faction == null ? "" : faction.trim();
    if (rank < 0) {
      throw new IllegalArgumentException("Rank must be non-negative for " + name + ": " + rank);
    }
  }

  public boolean sameFactionAs(Senator other) {
    return other != null && !faction.isBlank() && faction.equalsIgnoreCase(other.faction);
  }

  public boolean sameSenatorAs(Senator other) {
    return other != null && id.equals(other.id);
  }
}
