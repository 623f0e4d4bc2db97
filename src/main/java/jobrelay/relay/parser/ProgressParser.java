package jobrelay.relay.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jobrelay.relay.model.JobEvent;
import jobrelay.relay.model.JobKind;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one line of job output into a structured {@link JobEvent}.
 *
 * Grammar, first match wins:
 * <ol>
 * <li>{@code WAITING:<seconds>} - rate-limit backoff</li>
 * <li>{@code [<current>/<total>] (<percent>%) ...} - progress</li>
 * <li>{@code TITLE_UPDATE:<json>} - generated title (kinds that support it)</li>
 * <li>{@code __COMPLETE__} - completion sentinel, not an event</li>
 * <li>{@code __ERROR__ <message>} - fatal error reported by the program</li>
 * <li>anything else - plain stdout/stderr line</li>
 * </ol>
 *
 * Stateless and thread-safe.
 */
public final class ProgressParser {

    public static final String COMPLETION_MARKER = "__COMPLETE__";

    private static final Pattern WAITING_PATTERN = Pattern.compile("^WAITING:(\\d+)$");
    private static final Pattern PROGRESS_PATTERN = Pattern.compile("^\\[(\\d+)/(\\d+)\\]\\s*\\((\\d+)%\\)");
    private static final Pattern TITLE_UPDATE_PATTERN = Pattern.compile("^TITLE_UPDATE:(.*)$");
    private static final Pattern ERROR_PATTERN = Pattern.compile("^__ERROR__\\s*(.*)$");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProgressParser() {
    }

    /**
     * Parse one complete line.
     *
     * @param kind    job kind the line belongs to
     * @param origin  pipe the line arrived on
     * @param rawLine line without its terminator
     * @return the event, or empty for blank lines and the completion sentinel
     */
    public static Optional<JobEvent> parseLine(JobKind kind, StreamOrigin origin, String rawLine) {
        if (rawLine == null || rawLine.isBlank()) {
            return Optional.empty();
        }

        Matcher waiting = WAITING_PATTERN.matcher(rawLine);
        if (waiting.matches()) {
            Integer seconds = toInt(waiting.group(1));
            if (seconds != null) {
                return Optional.of(JobEvent.waiting(seconds));
            }
            return Optional.of(plain(origin, rawLine));
        }

        Matcher progress = PROGRESS_PATTERN.matcher(rawLine);
        if (progress.find()) {
            Integer current = toInt(progress.group(1));
            Integer total = toInt(progress.group(2));
            Integer percent = toInt(progress.group(3));
            if (current != null && total != null && percent != null) {
                return Optional.of(JobEvent.progress(current, total, percent, rawLine));
            }
            return Optional.of(plain(origin, rawLine));
        }

        if (kind.supportsTitleUpdates()) {
            Matcher titleUpdate = TITLE_UPDATE_PATTERN.matcher(rawLine);
            if (titleUpdate.matches()) {
                return Optional.of(parseTitleUpdate(titleUpdate.group(1)).orElseGet(() -> plain(origin, rawLine)));
            }
        }

        if (isCompletionMarker(rawLine)) {
            return Optional.empty();
        }

        Matcher error = ERROR_PATTERN.matcher(rawLine);
        if (error.matches()) {
            return Optional.of(JobEvent.error(error.group(1)));
        }

        return Optional.of(plain(origin, rawLine));
    }

    /** Whether the line is the graceful completion sentinel */
    public static boolean isCompletionMarker(String rawLine) {
        return COMPLETION_MARKER.equals(rawLine);
    }

    private static Optional<JobEvent> parseTitleUpdate(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(JobEvent.titleUpdate(
                    text(node, "album"),
                    text(node, "filename"),
                    text(node, "title")));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JobEvent plain(StreamOrigin origin, String rawLine) {
        return origin == StreamOrigin.STDERR ? JobEvent.stderr(rawLine) : JobEvent.stdout(rawLine);
    }

    // digits only, but may still overflow int
    private static Integer toInt(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
