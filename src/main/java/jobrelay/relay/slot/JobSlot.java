package jobrelay.relay.slot;

import jobrelay.relay.hub.BroadcastHub;
import jobrelay.relay.hub.JobSubscriber;
import jobrelay.relay.model.EventType;
import jobrelay.relay.model.JobEvent;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.SlotState;
import jobrelay.relay.notify.JobNotifier;
import jobrelay.relay.notify.Notification;
import jobrelay.relay.process.JobCommand;
import jobrelay.relay.process.LaunchedProcess;
import jobrelay.relay.process.ProcessExit;
import jobrelay.relay.process.ProcessLauncher;
import jobrelay.relay.process.ProcessListener;
import jobrelay.relay.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The single live-or-recently-completed run of one job kind.
 *
 * State machine: IDLE -> RUNNING -> COMPLETE. A slot never goes back to IDLE; once
 * complete it is evicted by the registry and a later start gets a brand-new slot.
 *
 * One lock covers the state check, the transition, subscriber registration and the
 * history append, so a start racing another start, an output line or a stop always
 * sees a consistent slot.
 */
public class JobSlot {

    private static final Logger log = LoggerFactory.getLogger(JobSlot.class);

    private final JobKind kind;
    private final BroadcastHub hub;
    private final JobNotifier notifier;
    private final Scheduler scheduler;
    private final Duration stopKillGrace;
    private final Consumer<JobSlot> onComplete;
    private final ReentrantLock lock = new ReentrantLock();

    private SlotState state = SlotState.IDLE;
    private Instant startedAt;
    private Instant finishedAt;
    private Integer exitCode;
    private boolean cancelled;
    private String userId;
    private LaunchedProcess process;

    /**
     * @param kind          job kind this slot runs
     * @param notifier      told about finished runs
     * @param scheduler     used to force-kill a stopped program that lingers
     * @param stopKillGrace how long a stopped program gets before it is killed
     * @param onComplete    called once, outside the lock, when the slot becomes COMPLETE
     */
    public JobSlot(JobKind kind, JobNotifier notifier, Scheduler scheduler, Duration stopKillGrace,
            Consumer<JobSlot> onComplete) {
        this.kind = kind;
        this.hub = new BroadcastHub(kind.id());
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.stopKillGrace = stopKillGrace;
        this.onComplete = onComplete;
    }

    /**
     * Spawn the job, or attach to the run already in progress.
     *
     * @param subscriber attached to the run either way; may be null
     * @param userId     user to notify when the run ends; may be null
     */
    public StartOutcome start(ProcessLauncher launcher, JobCommand command, JobSubscriber subscriber, String userId) {
        boolean spawnFailed = false;
        lock.lock();
        try {
            switch (state) {
                case COMPLETE:
                    return StartOutcome.ALREADY_COMPLETE;
                case RUNNING:
                    log.info("[{}] attaching {} to running job", kind, subscriberId(subscriber));
                    attachLocked(subscriber);
                    return StartOutcome.ATTACHED;
                default:
                    break;
            }

            startedAt = Instant.now();
            this.userId = userId;
            state = SlotState.RUNNING;
            try {
                // output callbacks from other threads block on the lock until this start returns
                process = launcher.launch(kind, command, new SlotListener());
                log.info("[{}] job started", kind);
            } catch (IOException | RuntimeException e) {
                log.error("[{}] failed to start {}: {}", kind, command.executable(), e.getMessage());
                hub.publish(JobEvent.error("Failed to start " + lowerFirst(kind.displayName()) + ": " + e.getMessage()));
                state = SlotState.COMPLETE;
                finishedAt = Instant.now();
                spawnFailed = true;
            }
            attachLocked(subscriber);
        } finally {
            lock.unlock();
        }

        if (spawnFailed) {
            onComplete.accept(this);
            return StartOutcome.SPAWN_FAILED;
        }
        return StartOutcome.STARTED;
    }

    /**
     * Attach a subscriber without starting anything. On a complete slot the history is
     * replayed and the subscriber closed.
     *
     * @return true if the subscriber will receive live events
     */
    public boolean attach(JobSubscriber subscriber) {
        lock.lock();
        try {
            return hub.attach(subscriber);
        } finally {
            lock.unlock();
        }
    }

    /** Drop a subscriber; the job keeps running */
    public void detach(JobSubscriber subscriber) {
        hub.detach(subscriber);
    }

    /**
     * Cancel the running job. The cancellation event is published right away, without
     * waiting for the program to die.
     */
    public StopOutcome stop() {
        LaunchedProcess stopped;
        lock.lock();
        try {
            if (state != SlotState.RUNNING) {
                return StopOutcome.NOTHING_TO_STOP;
            }

            stopped = terminateLocked();
            cancelled = true;
            finishedAt = Instant.now();
            state = SlotState.COMPLETE;
            hub.publish(JobEvent.cancelled(kind.displayName() + " stopped by user"));
            log.info("[{}] job stopped by user", kind);
        } finally {
            lock.unlock();
        }

        scheduleKill(stopped);
        onComplete.accept(this);
        return StopOutcome.STOPPED;
    }

    private void onOutput(JobEvent event) {
        Notification notification = null;
        LaunchedProcess failed = null;
        lock.lock();
        try {
            if (state != SlotState.RUNNING) {
                log.debug("[{}] dropping {} event, slot is {}", kind, event.type().wireName(), state);
                return;
            }
            hub.publish(event);

            if (event.type() == EventType.ERROR) {
                // program reported a fatal error; end it and ignore its eventual exit
                failed = terminateLocked();
                finishedAt = Instant.now();
                state = SlotState.COMPLETE;
                log.warn("[{}] job reported error: {}", kind, event.message());
                notification = notification(false, event.message());
            }
        } finally {
            lock.unlock();
        }

        if (notification != null) {
            scheduleKill(failed);
            dispatch(notification);
            onComplete.accept(this);
        }
    }

    /** SIGTERM the owned program; caller holds the lock */
    private LaunchedProcess terminateLocked() {
        LaunchedProcess owned = process;
        if (owned == null) {
            return null;
        }
        try {
            owned.terminate();
        } catch (RuntimeException e) {
            log.warn("[{}] failed to signal pid {}: {}", kind, owned.pid(), e.getMessage());
        }
        return owned;
    }

    /** Force-kill the program if it is still alive once the grace period is over */
    private void scheduleKill(LaunchedProcess target) {
        if (target == null) {
            return;
        }
        scheduler.schedule("kill-" + kind.id(), () -> {
            if (target.isAlive()) {
                log.warn("[{}] pid {} ignored SIGTERM, killing it", kind, target.pid());
                target.kill();
            }
        }, stopKillGrace);
    }

    private void onExit(ProcessExit exit) {
        Notification notification;
        lock.lock();
        try {
            if (state != SlotState.RUNNING) {
                log.debug("[{}] exit code {} after completion, ignored", kind, exit.exitCode());
                return;
            }

            finishedAt = Instant.now();
            exitCode = exit.exitCode();
            String message = exit.isSuccess()
                    ? kind.displayName() + " complete (" + formatElapsed(Duration.between(startedAt, finishedAt)) + ")"
                    : kind.displayName() + " failed with code " + exit.exitCode();
            if (exit.completionMarkerSeen() && !exit.isSuccess()) {
                log.warn("[{}] completion marker seen but exit code is {}", kind, exit.exitCode());
            }

            hub.publish(JobEvent.complete(exit.exitCode(), message));
            state = SlotState.COMPLETE;
            log.info("[{}] {}", kind, message);
            notification = notification(exit.isSuccess(), message);
        } finally {
            lock.unlock();
        }

        dispatch(notification);
        onComplete.accept(this);
    }

    private Notification notification(boolean success, String body) {
        String title = kind.notificationPrefix() + (success ? " Complete" : " Failed");
        return new Notification(title, body, kind.notificationTag(), false);
    }

    private void dispatch(Notification notification) {
        if (userId == null) {
            return;
        }
        try {
            notifier.notify(userId, notification);
        } catch (RuntimeException e) {
            log.warn("[{}] failed to send notification: {}", kind, e.getMessage());
        }
    }

    private void attachLocked(JobSubscriber subscriber) {
        if (subscriber != null) {
            hub.attach(subscriber);
        }
    }

    // Getters
    public JobKind kind() {
        return kind;
    }

    public SlotState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public SlotStatus snapshot() {
        lock.lock();
        try {
            return new SlotStatus(kind, state, startedAt, finishedAt, exitCode, cancelled,
                    hub.subscriberCount(), hub.history());
        } finally {
            lock.unlock();
        }
    }

    /** "42s" under a minute, otherwise minutes with one decimal, e.g. "3.5m" */
    static String formatElapsed(Duration elapsed) {
        long seconds = Math.round(elapsed.toMillis() / 1000.0);
        if (seconds < 60) {
            return seconds + "s";
        }
        return String.format(Locale.ROOT, "%.1fm", elapsed.toMillis() / 60000.0);
    }

    private static String lowerFirst(String s) {
        // keep acronyms like "AI" intact
        if (s.length() > 1 && Character.isUpperCase(s.charAt(1))) {
            return s;
        }
        return Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }

    private static String subscriberId(JobSubscriber subscriber) {
        return subscriber == null ? "nobody" : subscriber.id();
    }

    /** Routes a launched program's callbacks into this slot */
    private final class SlotListener implements ProcessListener {
        @Override
        public void onEvent(JobEvent event) {
            onOutput(event);
        }

        @Override
        public void onExit(ProcessExit exit) {
            JobSlot.this.onExit(exit);
        }
    }
}
