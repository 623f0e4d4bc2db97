package jobrelay.relay.process;

/**
 * Handle to a running external program, owned by exactly one job slot.
 */
public interface LaunchedProcess {

    long pid();

    boolean isAlive();

    /** Ask the program to exit (SIGTERM) */
    void terminate();

    /** Kill the program without giving it a chance to clean up */
    void kill();
}
