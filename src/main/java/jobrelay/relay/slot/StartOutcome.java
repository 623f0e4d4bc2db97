package jobrelay.relay.slot;

/**
 * Result of asking a slot to start its job.
 */
public enum StartOutcome {
    /** A new program was spawned and the caller attached to it */
    STARTED,
    /** A run was already active; the caller attached to it instead */
    ATTACHED,
    /** The program could not be spawned; the slot completed with an error event */
    SPAWN_FAILED,
    /** The slot already finished a run and must be replaced by the registry */
    ALREADY_COMPLETE
}
