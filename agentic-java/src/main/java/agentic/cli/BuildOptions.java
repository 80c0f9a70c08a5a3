package agentic.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Settings of one build run. {@code environment} returns null for an unset variable.
 */
public record BuildOptions(
        List<Path> inputs,
        Path outRoot,
        Path settingsPath,
        Function<String, String> environment
) {
    public BuildOptions {
        inputs = List.copyOf(inputs);
        outRoot = outRoot == null ? Path.of(".") : outRoot;
        settingsPath = settingsPath == null ? outRoot.resolve(".claude").resolve("settings.json") : settingsPath;
        environment = environment == null ? System::getenv : environment;
    }

    public static BuildOptions of(List<Path> inputs, Path outRoot) {
        return new BuildOptions(inputs, outRoot, null, null);
    }

    public BuildOptions withEnvironment(Function<String, String> env) {
        return new BuildOptions(inputs, outRoot, settingsPath, env);
    }

    /**
     * Parses {@code build <files...> [--out dir] [--settings path]}.
     *
     * @throws IllegalArgumentException on malformed arguments
     */
    public static BuildOptions parse(String[] args) {
        if (args.length < 1 || !args[0].equals("build")) {
            throw new IllegalArgumentException("Expected command 'build'");
        }
        List<Path> inputs = new ArrayList<>();
        Path out = null;
        Path settings = null;
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--out" -> out = Path.of(value(args, ++i, arg));
                case "--settings" -> settings = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option " + arg);
                    inputs.add(Path.of(arg));
                }
            }
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("No input files");
        }
        return new BuildOptions(inputs, out, settings, null);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) throw new IllegalArgumentException(option + " requires a value");
        return args[index];
    }
}
