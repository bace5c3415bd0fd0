package org.testnet.universe.node;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.artifact.ArtifactDistributor;
import org.testnet.universe.artifact.Artifacts;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.remote.LaunchSpec;
import org.testnet.universe.remote.RemoteHost;
import org.testnet.universe.remote.RemoteHostFactory;
import org.testnet.universe.remote.StateMode;
import org.testnet.universe.topology.FullnodeConfig;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Starts and stops single nodes. The only component that moves a {@link NodeRecord} through
 * its lifecycle.
 * <p>
 * Stops on different nodes share no state and can run concurrently.
 */
@Slf4j
@Builder
public class NodeLifecycleController {

    @NonNull
    private final RemoteHostFactory remoteHosts;

    @NonNull
    private final RunLogs runLogs;

    @Default
    @NonNull
    private final LifecycleParams params = LifecycleParams.DEFAULT;

    @Default
    @NonNull
    private final ArtifactDistributor distributor = new ArtifactDistributor();

    /**
     * Prepares the node's host, pushes the files it needs and launches the node process in its
     * own process group.
     * <p>
     * The node moves PENDING -> STARTING -> RUNNING, or to FAILED if any step fails. Returning
     * means the process group was forked and is alive, not that the node has synced.
     *
     * @throws NodeException if the node could not be started
     */
    public void start(@NonNull NodeRecord node, @NonNull Artifacts artifacts, @NonNull FullnodeConfig config,
                      @NonNull StateMode mode, @NonNull LaunchContext context) {
        if (!node.transitionTo(NodeState.STARTING)) {
            throw new NodeException(node.getHost(), "Can't start a node in state " + node.getState());
        }

        log.info("Starting {}: {}", node.getRole().getLaunchName(), node.getHost());
        runLogs.append(node, "--- Starting " + node.getRole().getLaunchName() + ": " + node.getHost());

        try {
            RemoteHost remote = remoteHosts.forHost(node.getHost());
            remote.prepareState(mode);
            distributor.distribute(remote, artifacts, node.getRole() == NodeRole.BOOTSTRAP_LEADER);

            long processGroup = remote.launch(launchSpec(node, artifacts, config, mode, context));
            node.addProcessGroup(processGroup);
            runLogs.alias(node, processGroup);
            runLogs.append(node, "Launched process group " + processGroup);

            if (!remote.isProcessGroupAlive(processGroup)) {
                throw new NodeException(node.getHost(), "Process group " + processGroup + " exited right after launch");
            }

            node.transitionTo(NodeState.RUNNING);
            log.info("Started {}: {}, process group: {}", node.getRole().getLaunchName(), node.getHost(), processGroup);
        } catch (RuntimeException e) {
            runLogs.append(node, "Start failed: " + e.getMessage());
            node.transitionTo(NodeState.FAILED);
            if (e instanceof NodeException) {
                throw e;
            }
            throw new NodeException(node.getHost(), "Can't start " + node.getRole().getLaunchName(), e);
        }
    }

    /**
     * Stops every process a node runs. Never throws: each failing step is logged and the next
     * one is attempted. Stopping a stopped or vanished node succeeds.
     * <p>
     * The node ends STOPPED, except a FAILED node which stays FAILED.
     */
    public void stop(@NonNull NodeRecord node) {
        log.info("Stopping {}: {}", node.getRole().getLaunchName(), node.getHost());

        try {
            RemoteHost remote = remoteHosts.forHost(node.getHost());
            bestEffort(node, "end interactive sessions", remote::endInteractiveSessions);

            Set<Long> processGroups = new LinkedHashSet<>(node.getProcessGroups());
            bestEffort(node, "read tracked process groups", () -> processGroups.addAll(remote.trackedProcessGroups()));
            for (long processGroup : processGroups) {
                bestEffort(node, "kill process group " + processGroup, () -> remote.killProcessGroup(processGroup));
            }

            List<Long> auxiliaryGroups = new ArrayList<>();
            bestEffort(node, "read auxiliary process groups",
                    () -> auxiliaryGroups.addAll(remote.auxiliaryProcessGroups(params.getAuxiliaryPidFiles())));
            for (long processGroup : auxiliaryGroups) {
                bestEffort(node, "kill auxiliary process group " + processGroup,
                        () -> remote.killPrivilegedProcessGroup(processGroup));
            }

            for (String pattern : params.getFallbackPatterns()) {
                bestEffort(node, "kill processes matching " + pattern, () -> remote.killByPattern(pattern));
            }
        } catch (RuntimeException e) {
            log.warn("Can't reach {} to stop it", node.getHost(), e);
        }

        node.clearProcessGroups();
        if (node.getState() != NodeState.FAILED) {
            node.transitionTo(NodeState.STOPPED);
        }
    }

    /**
     * Closes the record of a node that will not be started in this run, e.g. because the
     * bootstrap leader failed. The node's host is not contacted.
     */
    public void abandon(@NonNull NodeRecord node) {
        if (node.getState() == NodeState.PENDING) {
            log.info("Not starting {}: {}", node.getRole().getLaunchName(), node.getHost());
            node.transitionTo(NodeState.STOPPED);
        }
    }

    private LaunchSpec launchSpec(NodeRecord node, Artifacts artifacts, FullnodeConfig config, StateMode mode,
                                  LaunchContext context) {
        LaunchSpec.LaunchSpecBuilder spec = LaunchSpec.builder()
                .name(node.getRole().getRemoteLogName())
                .arg(artifacts.getDeployMethod().getLaunchName());

        if (node.getRole().isClient()) {
            spec.launcher(params.getClientLauncher())
                    .arg(context.getEntryPointHost());
        } else {
            spec.launcher(params.getNodeLauncher())
                    .arg(node.getRole().getLaunchName())
                    .arg(String.valueOf(config.isPublicNetwork()))
                    .arg(context.getEntryPointHost())
                    .arg(String.valueOf(context.getNodeCount()))
                    .arg(String.valueOf(mode == StateMode.REUSE))
                    .arg(String.valueOf(config.isLeaderRotation()))
                    .args(config.surfaceFlags());
        }

        runLogs.getParams().getVerbosity().ifPresent(verbosity ->
                spec.env(runLogs.getParams().getVerbosityVariable(), verbosity)
        );
        return spec.build();
    }

    private void bestEffort(NodeRecord node, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Stop {}: can't {}", node.getHost(), step, e);
        }
    }
}
