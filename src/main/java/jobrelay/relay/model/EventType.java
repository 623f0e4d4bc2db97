package jobrelay.relay.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag of a {@link JobEvent}, serialized as the {@code type} field.
 */
public enum EventType {
    STDOUT("stdout"),
    STDERR("stderr"),
    PROGRESS("progress"),
    WAITING("waiting"),
    TITLE_UPDATE("titleUpdate"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Terminal events end a run's history */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
