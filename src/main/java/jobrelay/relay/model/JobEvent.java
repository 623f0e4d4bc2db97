package jobrelay.relay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a job run's event stream.
 *
 * Events are tagged by {@link EventType}; fields that do not apply to a type are null
 * and left out of the JSON encoding, so every frame reads {@code {"type": ..., ...fields}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobEvent(
        @JsonProperty("type") EventType type,
        @JsonProperty("message") String message,
        @JsonProperty("current") Integer current,
        @JsonProperty("total") Integer total,
        @JsonProperty("percent") Integer percent,
        @JsonProperty("seconds") Integer seconds,
        @JsonProperty("album") String album,
        @JsonProperty("filename") String filename,
        @JsonProperty("title") String title,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("cancelled") Boolean cancelled,
        @JsonProperty("timestamp") Instant timestamp) {

    public JobEvent {
        Objects.requireNonNull(type, "type is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static JobEvent stdout(String message) {
        return new JobEvent(EventType.STDOUT, message, null, null, null, null, null, null, null, null, null, null);
    }

    public static JobEvent stderr(String message) {
        return new JobEvent(EventType.STDERR, message, null, null, null, null, null, null, null, null, null, null);
    }

    public static JobEvent progress(int current, int total, int percent, String message) {
        return new JobEvent(EventType.PROGRESS, message, current, total, percent, null, null, null, null, null, null,
                null);
    }

    public static JobEvent waiting(int seconds) {
        return new JobEvent(EventType.WAITING, null, null, null, null, seconds, null, null, null, null, null, null);
    }

    public static JobEvent titleUpdate(String album, String filename, String title) {
        return new JobEvent(EventType.TITLE_UPDATE, null, null, null, null, null, album, filename, title, null, null,
                null);
    }

    public static JobEvent complete(int exitCode, String message) {
        return new JobEvent(EventType.COMPLETE, message, null, null, null, null, null, null, null, exitCode, null,
                null);
    }

    /** Terminal event published when a running job is stopped on request; carries no exit code */
    public static JobEvent cancelled(String message) {
        return new JobEvent(EventType.COMPLETE, message, null, null, null, null, null, null, null, null, true, null);
    }

    public static JobEvent error(String message) {
        return new JobEvent(EventType.ERROR, message, null, null, null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type.isTerminal();
    }

    @JsonIgnore
    public boolean isCancellation() {
        return type == EventType.COMPLETE && Boolean.TRUE.equals(cancelled);
    }
}
