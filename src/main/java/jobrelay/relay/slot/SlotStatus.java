package jobrelay.relay.slot;

import jobrelay.relay.model.JobEvent;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.SlotState;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a slot.
 */
public record SlotStatus(
        JobKind kind,
        SlotState state,
        Instant startedAt,
        Instant finishedAt,
        Integer exitCode,
        boolean cancelled,
        int subscribers,
        List<JobEvent> events) {

    public boolean isRunning() {
        return state == SlotState.RUNNING;
    }

    public boolean isComplete() {
        return state == SlotState.COMPLETE;
    }
}
