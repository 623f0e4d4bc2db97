package jobrelay.relay.process;

import jobrelay.relay.model.JobKind;

import java.io.IOException;

/**
 * SPI for spawning a job's external program.
 */
public interface ProcessLauncher {

    /**
     * Spawn the program and start streaming its output to the listener.
     *
     * @throws IOException if the program cannot be started (missing executable, no permission)
     */
    LaunchedProcess launch(JobKind kind, JobCommand command, ProcessListener listener) throws IOException;
}
