package jobrelay;

import jobrelay.relay.config.RelayConfig;
import jobrelay.relay.server.RelayNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: starts the relay server with environment-based config and
 * stops it, cancelling running jobs, on JVM shutdown.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        RelayConfig config = RelayConfig.fromEnv();
        log.info("Starting job relay on port {}...", config.serverPort());

        if (!RelayNettyServer.start(config)) {
            log.error("Job relay failed to start");
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            RelayNettyServer.stop();
        }, "jobrelay-shutdown"));
    }
}
