package org.testnet.universe.deploy;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import org.testnet.universe.universe.UniverseException;

import java.nio.file.Path;
import java.util.List;

/**
 * One or more nodes could not be launched, or a deployment was refused before it began.
 * <p>
 * Failures of follower launches are aggregated: each cause is attached as a suppressed
 * exception, and the start logs of the failed nodes are listed.
 */
public class DeploymentException extends UniverseException {

    @Getter
    private final ImmutableList<String> failedHosts;

    @Getter
    private final ImmutableList<Path> logFiles;

    public DeploymentException(String message) {
        super(message);
        this.failedHosts = ImmutableList.of();
        this.logFiles = ImmutableList.of();
    }

    public DeploymentException(String message, String host, Path logFile, Throwable cause) {
        super(message, cause);
        this.failedHosts = ImmutableList.of(host);
        this.logFiles = ImmutableList.of(logFile);
    }

    public DeploymentException(String message, List<String> failedHosts, List<Path> logFiles,
                               List<? extends Throwable> causes) {
        super(message);
        this.failedHosts = ImmutableList.copyOf(failedHosts);
        this.logFiles = ImmutableList.copyOf(logFiles);
        causes.forEach(this::addSuppressed);
    }
}
