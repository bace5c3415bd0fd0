package org.testnet.universe.remote;

import com.google.common.collect.ImmutableMap;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs a command on the controlling host and waits for it to finish.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Runs the command.
     *
     * @param command     program and arguments
     * @param environment variables added to the inherited environment
     * @param workDir     working directory, or null for the current one
     * @param timeout     the command is killed and a {@link RemoteException} thrown after this duration
     * @return exit code and output of the finished command
     * @throws RemoteException if the command can't be started, times out or is interrupted
     */
    CommandResult run(List<String> command, Map<String, String> environment, Path workDir, Duration timeout);

    default CommandResult run(List<String> command, Duration timeout) {
        return run(command, ImmutableMap.of(), null, timeout);
    }
}
