package jobrelay.relay.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs delayed background work:
 * - slot eviction after the post-completion grace period
 * - forced kill of a stopped program that ignored SIGTERM
 *
 * Uses a single-threaded executor; tasks are short and never block.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;

    private volatile boolean running = true;

    public Scheduler() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jobrelay-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a task once after the given delay.
     *
     * @param name  label used when logging failures
     * @param task  work to run
     * @param delay how long to wait
     * @return handle to cancel the task, or null if the scheduler is stopped
     */
    public ScheduledFuture<?> schedule(String name, Runnable task, Duration delay) {
        if (!running) {
            log.warn("Scheduler stopped, dropping task {}", name);
            return null;
        }
        log.debug("Scheduling {} in {}ms", name, delay.toMillis());
        return executor.schedule(wrapRunnable(name, task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop the scheduler gracefully. Pending delayed tasks are discarded.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdownNow();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler did not terminate in time");
            } else {
                log.info("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
