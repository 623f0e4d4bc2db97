package jobrelay.relay.process;

import jobrelay.relay.config.RelayConfig;
import jobrelay.relay.model.JobKind;
import jobrelay.relay.model.StartOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the command line of each job kind's external program.
 *
 * Defaults run the gallery's Node.js maintenance scripts from the project root;
 * a configured override replaces the executable and arguments.
 */
public class JobCommands {

    private final RelayConfig config;

    public JobCommands(RelayConfig config) {
        this.config = config;
    }

    public JobCommand commandFor(JobKind kind, StartOptions options) {
        Path root = config.projectRoot().toAbsolutePath().normalize();

        List<String> command = new ArrayList<>(config.commandOverride(kind).orElseGet(() -> defaultCommand(kind, root)));
        if (kind == JobKind.AI_TITLES && options.forceRegenerate()) {
            command.add("--force");
        }

        Map<String, String> env = new HashMap<>();
        // keep progress output free of colors and spinners
        env.put("TERM", "dumb");
        if (kind == JobKind.VIDEO_REPROCESS) {
            env.put("TS_NODE_PROJECT", root.resolve("backend/tsconfig.json").toString());
        }

        return new JobCommand(command, env, root);
    }

    private List<String> defaultCommand(JobKind kind, Path root) {
        String node = config.nodeExecutable();
        return switch (kind) {
            case AI_TITLES -> List.of(node, root.resolve("scripts/generate-ai-titles.js").toString());
            case VIDEO_OPTIMIZE -> List.of(node, root.resolve("scripts/generate-master-playlists.js").toString());
            case VIDEO_REPROCESS -> List.of(node,
                    "--no-warnings",
                    "--loader", root.resolve("node_modules/ts-node/esm.mjs").toString(),
                    root.resolve("scripts/reprocess_all_videos.js").toString());
        };
    }
}
