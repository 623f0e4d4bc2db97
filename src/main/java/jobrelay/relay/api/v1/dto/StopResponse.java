package jobrelay.relay.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.slot.StopOutcome;

/**
 * Response DTO for stopping a job.
 * POST /api/v1/jobs/{kind}/stop
 */
public record StopResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message) {

    public static StopResponse from(JobKind kind, StopOutcome outcome) {
        if (outcome == StopOutcome.STOPPED) {
            return new StopResponse(true, kind.displayName() + " stopped");
        }
        return new StopResponse(false, "No " + kind.displayName() + " job running");
    }
}
