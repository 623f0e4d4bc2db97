package jobrelay.relay.slot;

/**
 * Slot a start request was routed to, and what happened there.
 */
public record StartResult(JobSlot slot, StartOutcome outcome) {
}
