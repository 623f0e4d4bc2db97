package jobrelay.relay.process;

/**
 * How a job's program ended.
 *
 * @param exitCode            process exit status; signal deaths carry the platform's synthetic code
 * @param completionMarkerSeen whether the program printed the {@code __COMPLETE__} sentinel
 */
public record ProcessExit(int exitCode, boolean completionMarkerSeen) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
