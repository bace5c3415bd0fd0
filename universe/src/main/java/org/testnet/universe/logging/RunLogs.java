package org.testnet.universe.logging;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.node.NodeRecord;
import org.testnet.universe.node.NodeRole;
import org.testnet.universe.universe.UniverseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * The log directory of a run: one file per node, named by role and host, plus an alias per
 * launched process group so that a log can also be found by the id a launch reported.
 */
@Slf4j
public class RunLogs {

    private static final String LOG_SUFFIX = ".log";

    @Getter
    @NonNull
    private final LoggingParams params;

    public RunLogs(@NonNull LoggingParams params) {
        this.params = params;
    }

    public Path getDirectory() {
        return params.getLogDir();
    }

    /**
     * Creates the log directory of the run if it does not exist yet.
     */
    public RunLogs prepare() {
        try {
            Files.createDirectories(params.getLogDir());
        } catch (IOException e) {
            throw new UniverseException("Can't create log directory: " + params.getLogDir(), e);
        }
        return this;
    }

    public Path nodeLog(NodeRole role, String host) {
        return params.getLogDir().resolve(role.getLaunchName() + "-" + host + LOG_SUFFIX);
    }

    /**
     * Local copy of a log fetched from a node's host.
     */
    public Path remoteLogCopy(String logName, String host) {
        return params.getLogDir().resolve("remote-" + logName + "-" + host + LOG_SUFFIX);
    }

    /**
     * Links {@code <role>-<processGroup>.log} to the node's log, replacing an older link of the
     * same name.
     */
    public void alias(NodeRecord node, long processGroup) {
        Path link = params.getLogDir().resolve(node.getRole().getLaunchName() + "-" + processGroup + LOG_SUFFIX);
        try {
            Files.deleteIfExists(link);
            Files.createSymbolicLink(link, node.getLogFile().getFileName());
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Can't create log alias {} for {}", link, node.getHost(), e);
        }
    }

    /**
     * Appends text to a node's log. Lines of different nodes go to different files, so
     * concurrent launches never interleave within one file.
     */
    public void append(NodeRecord node, String text) {
        try {
            Files.createDirectories(node.getLogFile().toAbsolutePath().getParent());
            Files.write(
                    node.getLogFile(),
                    (text + System.lineSeparator()).getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND
            );
        } catch (IOException e) {
            log.warn("Can't write to log {}", node.getLogFile(), e);
        }
    }

    /**
     * The last lines of a node's log, empty if the log can't be read.
     */
    public ImmutableList<String> tail(NodeRecord node) {
        Path logFile = node.getLogFile();
        if (!Files.isReadable(logFile)) {
            return ImmutableList.of();
        }

        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - params.getSurfacedLogLines());
            return ImmutableList.copyOf(lines.subList(from, lines.size()));
        } catch (IOException e) {
            log.warn("Can't read log {}", logFile, e);
            return ImmutableList.of();
        }
    }
}
