package jobrelay.relay.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jobrelay.relay.model.JobEvent;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.SlotState;
import jobrelay.relay.slot.SlotStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for job status.
 * GET /api/v1/jobs/{kind}/status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        @JsonProperty("kind") JobKind kind,
        @JsonProperty("state") SlotState state,
        @JsonProperty("running") boolean running,
        @JsonProperty("complete") Boolean complete,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("cancelled") Boolean cancelled,
        @JsonProperty("subscribers") Integer subscribers,
        @JsonProperty("events") List<JobEvent> events) {

    public static JobStatusResponse from(SlotStatus status) {
        return new JobStatusResponse(
                status.kind(),
                status.state(),
                status.isRunning(),
                status.isComplete(),
                status.startedAt(),
                status.finishedAt(),
                status.exitCode(),
                status.cancelled(),
                status.subscribers(),
                status.events());
    }

    /** No slot exists for the kind */
    public static JobStatusResponse idle(JobKind kind) {
        return new JobStatusResponse(kind, SlotState.IDLE, false, null, null, null, null, null, null, null);
    }
}
