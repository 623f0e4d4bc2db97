package jobrelay.relay.config;

import jobrelay.relay.model.JobKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration holder for the job relay.
 * All settings have sensible defaults; {@link #fromEnv()} applies environment overrides.
 */
public final class RelayConfig {

    // Server settings
    private int serverPort = 3001;
    private String serverHost = "0.0.0.0";
    private Duration subscriberWriteTimeout = Duration.ofSeconds(30);

    // Job settings
    private Path projectRoot = Path.of(".");
    private String nodeExecutable = "node";
    private Duration evictionGrace = Duration.ofMinutes(5);
    private Duration stopKillGrace = Duration.ofSeconds(10);
    private final Map<JobKind, List<String>> commandOverrides = new EnumMap<>(JobKind.class);

    // Auth settings (optional)
    private String adminKey = null; // If set, job endpoints require X-JobRelay-Key

    private RelayConfig() {
    }

    public static RelayConfig defaults() {
        return new RelayConfig();
    }

    public static RelayConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static RelayConfig fromEnv(Map<String, String> env) {
        RelayConfig config = new RelayConfig();

        String port = env.get("JOBRELAY_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.trim());
        }

        String host = env.get("JOBRELAY_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.trim();
        }

        String root = env.get("JOBRELAY_PROJECT_ROOT");
        if (root != null && !root.isBlank()) {
            config.projectRoot = Path.of(root.trim());
        }

        String node = env.get("JOBRELAY_NODE");
        if (node != null && !node.isBlank()) {
            config.nodeExecutable = node.trim();
        }

        String eviction = env.get("JOBRELAY_EVICTION_SECONDS");
        if (eviction != null && !eviction.isBlank()) {
            config.evictionGrace = Duration.ofSeconds(Long.parseLong(eviction.trim()));
        }

        String killGrace = env.get("JOBRELAY_STOP_KILL_SECONDS");
        if (killGrace != null && !killGrace.isBlank()) {
            config.stopKillGrace = Duration.ofSeconds(Long.parseLong(killGrace.trim()));
        }

        String writeTimeout = env.get("JOBRELAY_WRITE_TIMEOUT_SECONDS");
        if (writeTimeout != null && !writeTimeout.isBlank()) {
            config.subscriberWriteTimeout = Duration.ofSeconds(Long.parseLong(writeTimeout.trim()));
        }

        String adminKey = env.get("JOBRELAY_ADMIN_KEY");
        if (adminKey != null && !adminKey.isBlank()) {
            config.adminKey = adminKey;
        }

        for (JobKind kind : JobKind.values()) {
            String cmd = env.get(commandEnvName(kind));
            if (cmd != null && !cmd.isBlank()) {
                config.commandOverrides.put(kind, Arrays.asList(cmd.trim().split("\\s+")));
            }
        }

        return config;
    }

    /** e.g. {@code JOBRELAY_CMD_VIDEO_REPROCESS} */
    static String commandEnvName(JobKind kind) {
        return "JOBRELAY_CMD_" + kind.name();
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration subscriberWriteTimeout() {
        return subscriberWriteTimeout;
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public String nodeExecutable() {
        return nodeExecutable;
    }

    public Duration evictionGrace() {
        return evictionGrace;
    }

    public Duration stopKillGrace() {
        return stopKillGrace;
    }

    /** Full command line replacing the default program for this kind, if configured */
    public Optional<List<String>> commandOverride(JobKind kind) {
        return Optional.ofNullable(commandOverrides.get(kind));
    }

    public String adminKey() {
        return adminKey;
    }

    public boolean hasAdminKey() {
        return adminKey != null && !adminKey.isBlank();
    }

    // Fluent setters for testing/customization
    public RelayConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public RelayConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public RelayConfig withProjectRoot(Path root) {
        this.projectRoot = root;
        return this;
    }

    public RelayConfig withNodeExecutable(String node) {
        this.nodeExecutable = node;
        return this;
    }

    public RelayConfig withEvictionGrace(Duration grace) {
        this.evictionGrace = grace;
        return this;
    }

    public RelayConfig withStopKillGrace(Duration grace) {
        this.stopKillGrace = grace;
        return this;
    }

    public RelayConfig withSubscriberWriteTimeout(Duration timeout) {
        this.subscriberWriteTimeout = timeout;
        return this;
    }

    public RelayConfig withCommand(JobKind kind, String... command) {
        this.commandOverrides.put(kind, List.of(command));
        return this;
    }

    public RelayConfig withAdminKey(String key) {
        this.adminKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "RelayConfig{" +
                "serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", projectRoot=" + projectRoot +
                ", evictionGrace=" + evictionGrace +
                ", stopKillGrace=" + stopKillGrace +
                ", commandOverrides=" + commandOverrides.keySet() +
                ", adminKeySet=" + hasAdminKey() +
                '}';
    }
}
