package jobrelay.relay.slot;

import jobrelay.relay.hub.JobSubscriber;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.SlotState;
import jobrelay.relay.notify.JobNotifier;
import jobrelay.relay.process.JobCommand;
import jobrelay.relay.process.ProcessLauncher;
import jobrelay.relay.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of job slots, one per {@link JobKind}.
 *
 * Concurrent starts for the same kind are folded into one spawn: the slot is picked
 * atomically and the slot's own lock decides which caller spawns and which attach.
 * A completed slot stays visible for the eviction grace period, then is dropped so the
 * next start begins with an empty history.
 */
public class JobSlotRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobSlotRegistry.class);

    private final ConcurrentHashMap<JobKind, JobSlot> slots = new ConcurrentHashMap<>();
    private final ProcessLauncher launcher;
    private final JobNotifier notifier;
    private final Scheduler scheduler;
    private final Duration evictionGrace;
    private final Duration stopKillGrace;

    public JobSlotRegistry(ProcessLauncher launcher, JobNotifier notifier, Scheduler scheduler,
            Duration evictionGrace, Duration stopKillGrace) {
        this.launcher = launcher;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.evictionGrace = evictionGrace;
        this.stopKillGrace = stopKillGrace;
    }

    /** Current slot for the kind, creating an idle one if there is none */
    public JobSlot getOrCreate(JobKind kind) {
        return slots.computeIfAbsent(kind, this::newSlot);
    }

    public Optional<JobSlot> find(JobKind kind) {
        return Optional.ofNullable(slots.get(kind));
    }

    /**
     * Start a job of the given kind, or attach the subscriber to the run in progress.
     * A slot left over from a finished run is replaced by a fresh one.
     */
    public StartResult start(JobKind kind, JobCommand command, JobSubscriber subscriber, String userId) {
        while (true) {
            JobSlot slot = slots.compute(kind, (k, current) ->
                    current == null || current.state() == SlotState.COMPLETE ? newSlot(k) : current);

            StartOutcome outcome = slot.start(launcher, command, subscriber, userId);
            if (outcome != StartOutcome.ALREADY_COMPLETE) {
                return new StartResult(slot, outcome);
            }
            // finished between lookup and start; go around for a fresh slot
            log.debug("[{}] slot completed during start, retrying", kind);
        }
    }

    public StopOutcome stop(JobKind kind) {
        return find(kind).map(JobSlot::stop).orElse(StopOutcome.NOTHING_TO_STOP);
    }

    /** Number of slots with a program currently running */
    public int runningCount() {
        int running = 0;
        for (JobSlot slot : slots.values()) {
            if (slot.state() == SlotState.RUNNING) {
                running++;
            }
        }
        return running;
    }

    /** Cancel every running job, used on shutdown */
    public void stopAll() {
        for (JobSlot slot : slots.values()) {
            if (slot.stop() == StopOutcome.STOPPED) {
                log.info("[{}] stopped on shutdown", slot.kind());
            }
        }
    }

    private JobSlot newSlot(JobKind kind) {
        return new JobSlot(kind, notifier, scheduler, stopKillGrace, this::scheduleEviction);
    }

    private void scheduleEviction(JobSlot slot) {
        JobKind kind = slot.kind();
        scheduler.schedule("evict-" + kind.id(), () -> {
            // a newer slot may have superseded this one; leave it alone
            if (slots.remove(kind, slot)) {
                log.info("[{}] cleaned up completed job", kind);
            }
        }, evictionGrace);
    }
}
