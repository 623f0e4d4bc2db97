package jobrelay.relay.model;

/**
 * Per-request options for starting a job.
 *
 * @param forceRegenerate AI titles only: regenerate titles that already exist
 * @param userId          user to notify on completion; null when unknown
 */
public record StartOptions(boolean forceRegenerate, String userId) {

    public static StartOptions defaults() {
        return new StartOptions(false, null);
    }
}
