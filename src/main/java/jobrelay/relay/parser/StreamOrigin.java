package jobrelay.relay.parser;

/**
 * Pipe a line of program output arrived on.
 */
public enum StreamOrigin {
    STDOUT,
    STDERR
}
