package org.testnet.universe.remote;

import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Typed operations on the host a node runs on. Every operation returns a structured result or
 * throws {@link RemoteException}; callers never parse command output.
 * <p>
 * Implementations decide how the host is reached (ssh, a local process sandbox, a test fake).
 */
public interface RemoteHost {

    /**
     * Address of the host.
     */
    String getHost();

    /**
     * Clears the state a previous run left on the host.
     *
     * @param mode delete everything, or relocate the persisted node configuration and keep it
     */
    void prepareState(StateMode mode);

    /**
     * Copies local files or directories to the host.
     */
    void transfer(List<Path> sources, RemoteDirectory target);

    /**
     * Launches a process in a new process group, records the group id in the host's tracking
     * directory and returns it. Returning means the process was forked, not that it is healthy.
     */
    long launch(LaunchSpec spec);

    boolean isProcessGroupAlive(long processGroup);

    /**
     * Process group ids recorded by previous launches on this host.
     */
    ImmutableList<Long> trackedProcessGroups();

    /**
     * Process groups of the auxiliary processes (system monitors started by the launcher)
     * whose process ids are kept in the given files, relative to the remote project directory.
     * A missing file or a process that is gone contributes nothing.
     */
    ImmutableList<Long> auxiliaryProcessGroups(List<String> pidFiles);

    /**
     * Terminates any interactive terminal session left on the host.
     */
    void endInteractiveSessions();

    /**
     * Kills every process of the group.
     */
    void killProcessGroup(long processGroup);

    /**
     * Kills every process of a group that runs as root.
     */
    void killPrivilegedProcessGroup(long processGroup);

    /**
     * Kills every process whose name matches. Matching nothing is not a failure.
     */
    void killByPattern(String pattern);

    /**
     * Runs a command inside the remote project directory and waits for it.
     */
    CommandResult execute(List<String> command, Duration timeout);

    /**
     * Copies a file, relative to the remote project directory, to a local path.
     */
    void fetch(String remotePath, Path localFile, Duration timeout);

    enum RemoteDirectory {
        /**
         * The per-node project directory holding scripts, config and logs.
         */
        PROJECT,
        /**
         * The directory deployed binaries are installed into.
         */
        BIN
    }
}
