package jobrelay.relay.process;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to spawn a job's external program.
 *
 * @param command          executable followed by its arguments
 * @param environment      variables added to (or overriding) the parent environment
 * @param workingDirectory directory the program runs in; null for the current one
 */
public record JobCommand(List<String> command, Map<String, String> environment, Path workingDirectory) {

    public JobCommand {
        Objects.requireNonNull(command, "command is required");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must name an executable");
        }
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public static JobCommand of(String... command) {
        return new JobCommand(List.of(command), Map.of(), null);
    }

    public String executable() {
        return command.get(0);
    }
}
