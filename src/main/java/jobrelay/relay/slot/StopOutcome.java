package jobrelay.relay.slot;

/**
 * Result of asking a slot to stop its job.
 */
public enum StopOutcome {
    /** The program was signalled and the run ended as cancelled */
    STOPPED,
    /** No run was active; nothing happened */
    NOTHING_TO_STOP
}
