package org.testnet.universe.logging;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Specifies where the logs of a run are collected and which log verbosity is handed to the
 * remote node processes.
 */
@Builder(toBuilder = true)
@ToString
public class LoggingParams {

    public static final String DEFAULT_VERBOSITY_VARIABLE = "RUST_LOG";

    /**
     * Directory holding the logs of every run.
     */
    @Default
    @NonNull
    @Getter
    private final Path logDir = Paths.get("net", "log");

    /**
     * Name of the environment variable carrying the log verbosity to the nodes.
     */
    @Default
    @NonNull
    @Getter
    private final String verbosityVariable = DEFAULT_VERBOSITY_VARIABLE;

    /**
     * The verbosity propagated unchanged to every node. Null means nothing is propagated.
     */
    private final String verbosity;

    /**
     * Number of trailing lines of a failed node's log surfaced in the controller output.
     */
    @Default
    @Getter
    private final int surfacedLogLines = 200;

    public Optional<String> getVerbosity() {
        return Optional.ofNullable(verbosity);
    }

    /**
     * Logging params picking the verbosity up from the controlling host's environment.
     */
    public static LoggingParams fromEnvironment(Path logDir, String verbosityVariable) {
        return LoggingParams.builder()
                .logDir(logDir)
                .verbosityVariable(verbosityVariable)
                .verbosity(System.getenv(verbosityVariable))
                .build();
    }
}
