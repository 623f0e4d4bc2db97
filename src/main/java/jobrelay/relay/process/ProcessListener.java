package jobrelay.relay.process;

import jobrelay.relay.model.JobEvent;

/**
 * Receives parsed output and the exit of a launched program.
 * Called from the runner's I/O threads.
 */
public interface ProcessListener {

    void onEvent(JobEvent event);

    /** Called exactly once, after all output has been delivered */
    void onExit(ProcessExit exit);
}
