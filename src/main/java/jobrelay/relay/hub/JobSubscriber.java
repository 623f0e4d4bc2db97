package jobrelay.relay.hub;

import jobrelay.relay.model.JobEvent;

/**
 * A live output sink attached to a job run, typically an open SSE response.
 */
public interface JobSubscriber {

    /** Stable identifier for logging */
    String id();

    /**
     * Deliver one event. Must not block on a slow peer.
     *
     * @throws SubscriberGoneException if the sink is dead and should be detached
     */
    void send(JobEvent event) throws SubscriberGoneException;

    /** End the stream after the terminal event. Must be safe to call on a dead sink. */
    void close();
}
