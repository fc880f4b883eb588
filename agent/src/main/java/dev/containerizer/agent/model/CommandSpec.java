package dev.containerizer.agent.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What to run inside the container. With {@code shell} set the value is handed to {@code sh -c}; otherwise the
 * value (if any) is the executable and {@code arguments} follow it.
 */
public record CommandSpec(
    boolean shell,
    String value,
    List<String> arguments,
    Map<String, String> environment,
    List<FetchUri> uris
) {

    public CommandSpec {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        uris = uris == null ? List.of() : List.copyOf(uris);
    }

    public static CommandSpec shell(String command) {
        return new CommandSpec(true, command, List.of(), Map.of(), List.of());
    }

    public static CommandSpec exec(String executable, List<String> arguments) {
        return new CommandSpec(false, executable, arguments, Map.of(), List.of());
    }

    /** Runs the image's default entrypoint and command. */
    public static CommandSpec imageDefault() {
        return new CommandSpec(false, null, List.of(), Map.of(), List.of());
    }

    public Optional<String> optionalValue() {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public CommandSpec withUris(List<FetchUri> uris) {
        return new CommandSpec(shell, value, arguments, environment, uris);
    }

    public CommandSpec withEnvironment(Map<String, String> environment) {
        return new CommandSpec(shell, value, arguments, environment, uris);
    }
}
