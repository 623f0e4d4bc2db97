package jobrelay.relay.model;

/**
 * Lifecycle state of a job slot.
 */
public enum SlotState {
    /** Slot created, nothing spawned yet */
    IDLE,
    /** External program is running */
    RUNNING,
    /** Program exited, was stopped, or failed to spawn */
    COMPLETE
}
