package jobrelay.relay.config;

import jobrelay.relay.api.v1.HealthController;
import jobrelay.relay.api.v1.JobStreamController;
import jobrelay.relay.notify.JobNotifier;
import jobrelay.relay.notify.LoggingJobNotifier;
import jobrelay.relay.process.JobCommands;
import jobrelay.relay.process.ProcessRunner;
import jobrelay.relay.scheduler.Scheduler;
import jobrelay.relay.server.RouterHandler;
import jobrelay.relay.slot.JobSlotRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all relay components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(RelayConfig.fromEnv());
 * JobSlotRegistry registry = deps.registry();
 * // ... serve requests ...
 * deps.close(); // stops running jobs and background threads
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final RelayConfig config;
    private final Scheduler scheduler;
    private final ProcessRunner processRunner;
    private final JobNotifier notifier;
    private final JobCommands jobCommands;
    private final JobSlotRegistry registry;

    // Controllers
    private final HealthController healthController;
    private final JobStreamController jobStreamController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(RelayConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.scheduler = new Scheduler();
        this.processRunner = new ProcessRunner();
        this.notifier = new LoggingJobNotifier();

        // Services
        this.jobCommands = new JobCommands(config);
        this.registry = new JobSlotRegistry(processRunner, notifier, scheduler,
                config.evictionGrace(), config.stopKillGrace());

        // Controllers
        this.healthController = new HealthController(registry);
        this.jobStreamController = new JobStreamController(registry, jobCommands);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(RelayConfig config) {
        return new Dependencies(config);
    }

    // Getters
    public RelayConfig config() {
        return config;
    }

    public JobSlotRegistry registry() {
        return registry;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(jobStreamController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop jobs first so their cancellation reaches connected clients
        try {
            registry.stopAll();
        } catch (Exception e) {
            log.warn("Error stopping jobs: {}", e.getMessage());
        }

        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        processRunner.close();

        log.info("Dependencies closed");
    }
}
