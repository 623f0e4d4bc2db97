package jobrelay.relay.hub;

import jobrelay.relay.model.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Single-producer, multi-consumer broadcast for one job run.
 *
 * Every published event is appended to an in-memory history and pushed to all attached
 * subscribers. A subscriber attaching late gets the full history replayed before any live
 * event, so replay-then-live is gapless. Attach, publish and detach are mutually exclusive.
 *
 * A failing subscriber is detached on the spot; the failure never reaches the publisher.
 */
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final String name;
    private final List<JobEvent> history = new ArrayList<>();
    private final Set<JobSubscriber> subscribers = new LinkedHashSet<>();

    public BroadcastHub(String name) {
        this.name = name;
    }

    /**
     * Replay the full history to the subscriber, then register it for live events.
     * If the history already ends with a terminal event the subscriber is closed instead
     * of registered.
     *
     * @return true if the subscriber is now registered
     */
    public synchronized boolean attach(JobSubscriber subscriber) {
        for (JobEvent event : history) {
            if (!deliver(subscriber, event)) {
                return false;
            }
        }

        if (isTerminated()) {
            subscriber.close();
            log.debug("[{}] replayed {} events to {} after termination", name, history.size(), subscriber.id());
            return false;
        }

        subscribers.add(subscriber);
        log.debug("[{}] subscriber {} attached after {} events ({} live)",
                name, subscriber.id(), history.size(), subscribers.size());
        return true;
    }

    /**
     * Append the event to the history and push it to every registered subscriber.
     * Once a terminal event is published all subscribers are closed and released.
     *
     * @return false if the history was already terminated and the event was dropped
     */
    public synchronized boolean publish(JobEvent event) {
        if (isTerminated()) {
            log.debug("[{}] dropping {} event after termination", name, event.type().wireName());
            return false;
        }

        history.add(event);

        // iterate a copy: closing a subscriber can detach it (or others) on this same thread
        List<JobSubscriber> failed = new ArrayList<>();
        for (JobSubscriber subscriber : List.copyOf(subscribers)) {
            if (!deliver(subscriber, event)) {
                failed.add(subscriber);
            }
        }
        failed.forEach(subscribers::remove);

        if (event.isTerminal()) {
            List<JobSubscriber> remaining = List.copyOf(subscribers);
            subscribers.clear();
            for (JobSubscriber subscriber : remaining) {
                subscriber.close();
            }
        }
        return true;
    }

    public synchronized void detach(JobSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            log.debug("[{}] subscriber {} detached ({} remaining)", name, subscriber.id(), subscribers.size());
        }
    }

    /** Immutable snapshot of the history */
    public synchronized List<JobEvent> history() {
        return List.copyOf(history);
    }

    public synchronized int size() {
        return history.size();
    }

    public synchronized int subscriberCount() {
        return subscribers.size();
    }

    /** Whether the history ends with a terminal event */
    public synchronized boolean isTerminated() {
        return !history.isEmpty() && history.get(history.size() - 1).isTerminal();
    }

    private boolean deliver(JobSubscriber subscriber, JobEvent event) {
        try {
            subscriber.send(event);
            return true;
        } catch (SubscriberGoneException e) {
            log.debug("[{}] subscriber {} gone: {}", name, subscriber.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[{}] subscriber {} failed, detaching", name, subscriber.id(), e);
        }
        subscriber.close();
        return false;
    }
}
