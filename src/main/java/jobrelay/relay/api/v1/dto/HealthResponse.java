package jobrelay.relay.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("runningJobs") int runningJobs) {

    public static HealthResponse healthy(String uptime, String version, int runningJobs) {
        return new HealthResponse("healthy", uptime, version, runningJobs);
    }
}
