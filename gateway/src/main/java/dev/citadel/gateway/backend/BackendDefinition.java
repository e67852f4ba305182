package dev.citadel.gateway.backend;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How to reach one named backend server: the command speaking MCP over stdio, its arguments,
 * extra environment entries and an optional working directory.
 */
public record BackendDefinition(String name, String command, List<String> args, Map<String, String> env,
        Path workingDirectory) {

    public BackendDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static BackendDefinition of(String name, String command, String... args) {
        return new BackendDefinition(name, command, List.of(args), Map.of(), null);
    }
}
