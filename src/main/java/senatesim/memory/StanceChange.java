package senatesim.memory;

import senatesim.domain.Stance;

import java.time.Instant;

public record StanceChange(Stance oldStance, Stance newStance, String reason, String eventId, Instant timestamp) {}
