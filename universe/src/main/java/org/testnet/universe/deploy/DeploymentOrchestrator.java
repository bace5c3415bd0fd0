package org.testnet.universe.deploy;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.artifact.ArtifactResolver;
import org.testnet.universe.artifact.Artifacts;
import org.testnet.universe.deploy.DeploymentMetrics.Milestone;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.node.LaunchContext;
import org.testnet.universe.node.NodeException;
import org.testnet.universe.node.NodeLifecycleController;
import org.testnet.universe.node.NodeRecord;
import org.testnet.universe.node.NodeRole;
import org.testnet.universe.remote.RemoteException;
import org.testnet.universe.remote.RemoteHostFactory;
import org.testnet.universe.remote.StateMode;
import org.testnet.universe.sanity.SanityChecker;
import org.testnet.universe.sanity.SanityOptions;
import org.testnet.universe.sanity.SanityResult;
import org.testnet.universe.topology.ClusterTopology;
import org.testnet.universe.util.Pauser;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Brings a cluster from cold start to a running state and takes it down again.
 * <p>
 * A start resolves the artifacts, launches the bootstrap leader and waits for it, launches
 * every follower concurrently under a {@link LaunchLimiter}, joins all follower launches,
 * runs the sanity battery and finally starts the clients without waiting for them.
 * A failure of the leader aborts the run before any follower is touched; follower failures
 * are collected until every launch has finished and then reported together.
 */
@Slf4j
@Builder
public class DeploymentOrchestrator {

    private static final Duration LOG_FETCH_TIMEOUT = Duration.ofSeconds(30);
    private static final String DRONE_LOG = "drone";

    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("deployment-%d")
                    .build()
    );

    @NonNull
    private final ArtifactResolver artifactResolver;

    @NonNull
    private final NodeLifecycleController lifecycle;

    @NonNull
    private final SanityChecker sanityChecker;

    @NonNull
    private final RemoteHostFactory remoteHosts;

    @NonNull
    private final RunLogs runLogs;

    @Default
    @NonNull
    private final Pauser pauser = Pauser.SLEEP;

    @Default
    @NonNull
    private final DeploymentMetrics metrics = DeploymentMetrics.inMemory();

    /**
     * Deploys and starts the cluster.
     *
     * @throws org.testnet.universe.artifact.ArtifactException if the artifacts can't be produced,
     *                                                          nothing was started
     * @throws DeploymentException                             if the leader or any follower failed
     * @throws org.testnet.universe.sanity.SanityException      if the started cluster is not sane
     */
    public DeploymentReport start(@NonNull DeploymentParams params) {
        log.info("Deployment started: {} nodes, {}", params.getTopology().size(), params.getArtifactSource());
        runLogs.prepare();

        Artifacts artifacts = resolve(params);
        metrics.milestone(Milestone.START_BEGIN);
        DeploymentReport report = deploy(params, artifacts);
        metrics.milestone(Milestone.START_COMPLETE);
        metrics.version(report.getNetworkVersion());
        return report;
    }

    /**
     * Replaces the nodes of a running cluster one at a time, keeping their configuration.
     *
     * @throws DeploymentException if leader rotation is disabled, before any node is touched
     */
    public DeploymentReport update(@NonNull DeploymentParams params) {
        if (!params.getFullnodeConfig().isLeaderRotation()) {
            throw new DeploymentException("Unable to update because leader rotation is disabled");
        }

        log.info("Update started: {} nodes, {}", params.getTopology().size(), params.getArtifactSource());
        runLogs.prepare();
        Artifacts artifacts = resolve(params);
        metrics.milestone(Milestone.UPDATE_BEGIN);

        ClusterTopology topology = params.getTopology();
        LaunchContext context = launchContext(topology);
        List<NodeRecord> replacements = new ArrayList<>();

        Stopwatch stopwatch = Stopwatch.createStarted();
        for (NodeRecord node : topology.getServers()) {
            lifecycle.stop(node);
            NodeRecord replacement = node.replacement();
            replacements.add(replacement);
            try {
                lifecycle.start(replacement, artifacts, params.getFullnodeConfig(), StateMode.REUSE, context);
            } catch (NodeException e) {
                surfaceLogs(ImmutableList.of(replacement));
                abandonPending(topology);
                throw new DeploymentException("Update of " + replacement.getHost() + " failed",
                        replacement.getHost(), replacement.getLogFile(), e);
            }
            if (node.getRole() == NodeRole.BOOTSTRAP_LEADER) {
                metrics.milestone(Milestone.LEADER_STARTED);
            }
        }
        Duration serverTime = stopwatch.elapsed();
        metrics.milestone(Milestone.FULLNODES_STARTED);

        topology.getClients().forEach(lifecycle::stop);
        topology.getClients().stream().map(NodeRecord::replacement).forEach(replacements::add);
        ClusterTopology updated = ClusterTopology.of(replacements);

        SanityResult sanity;
        try {
            sanity = verifySanity(updated, params.getSanityOptions());
        } catch (RuntimeException e) {
            abandonPending(updated);
            throw e;
        }

        stopwatch.reset().start();
        CompletableFuture<Void> clients = startClients(updated, artifacts, params, StateMode.REUSE, context);
        metrics.milestone(Milestone.UPDATE_COMPLETE);
        metrics.version(artifacts.getVersion());

        return DeploymentReport.builder()
                .networkVersion(artifacts.getVersion())
                .leaderDeployTime(Duration.ZERO)
                .followerDeployTime(serverTime)
                .clientDeployTime(stopwatch.elapsed())
                .topology(updated)
                .sanity(sanity)
                .logDirectory(runLogs.getDirectory())
                .clientLaunches(clients)
                .build();
    }

    /**
     * Stops every node of the topology, clients included, concurrently. Never fails.
     */
    public Duration stop(@NonNull ClusterTopology topology) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        metrics.milestone(Milestone.STOP_BEGIN);
        CompletableFuture<?>[] stops = topology.getNodes().stream()
                .map(node -> CompletableFuture.runAsync(() -> lifecycle.stop(node), WORKERS))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(stops).join();
        metrics.milestone(Milestone.STOP_COMPLETE);

        log.info("Stopping {} nodes took {}", topology.size(), stopwatch);
        return stopwatch.elapsed();
    }

    /**
     * Stops the cluster and starts it again with fresh node records.
     */
    public DeploymentReport restart(@NonNull DeploymentParams params) {
        stop(params.getTopology());
        return start(params.toBuilder()
                .topology(params.getTopology().map(NodeRecord::replacement))
                .build());
    }

    /**
     * Runs the sanity battery against the cluster without deploying anything.
     *
     * @throws org.testnet.universe.sanity.SanityException if a check fails
     */
    public SanityResult sanity(@NonNull DeploymentParams params) {
        return verifySanity(params.getTopology(), params.getSanityOptions());
    }

    /**
     * Copies the log every node keeps on its host into the run log directory. A log that
     * can't be copied is reported and skipped.
     *
     * @return the local copies
     */
    public ImmutableList<Path> fetchLogs(@NonNull ClusterTopology topology) {
        runLogs.prepare();
        ImmutableList.Builder<Path> fetched = ImmutableList.builder();

        NodeRecord leader = topology.getBootstrapLeader();
        fetchLog(leader.getHost(), DRONE_LOG).ifPresent(fetched::add);
        for (NodeRecord node : topology.getNodes()) {
            fetchLog(node.getHost(), node.getRole().getRemoteLogName()).ifPresent(fetched::add);
        }
        return fetched.build();
    }

    private Optional<Path> fetchLog(String host, String logName) {
        Path target = runLogs.remoteLogCopy(logName, host);
        log.info("Fetching {} from {}", logName, host);
        try {
            remoteHosts.forHost(host).fetch(logName + ".log", target, LOG_FETCH_TIMEOUT);
            return Optional.of(target);
        } catch (RemoteException e) {
            log.warn("Failed to fetch {} log from {}", logName, host, e);
            return Optional.empty();
        }
    }

    private DeploymentReport deploy(DeploymentParams params, Artifacts artifacts) {
        ClusterTopology topology = params.getTopology();
        LaunchContext context = launchContext(topology);
        NodeRecord leader = topology.getBootstrapLeader();

        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            lifecycle.start(leader, artifacts, params.getFullnodeConfig(), params.getStateMode(), context);
        } catch (NodeException e) {
            surfaceLogs(ImmutableList.of(leader));
            abandonPending(topology);
            throw new DeploymentException("Bootstrap leader failed to start: " + leader.getHost(),
                    leader.getHost(), leader.getLogFile(), e);
        }
        Duration leaderTime = stopwatch.elapsed();
        metrics.milestone(Milestone.LEADER_STARTED);
        log.info("Bootstrap leader deployment took {}", leaderTime);

        stopwatch.reset().start();
        launchFollowers(topology, artifacts, params, context);
        Duration followerTime = stopwatch.elapsed();
        metrics.milestone(Milestone.FULLNODES_STARTED);
        log.info("Additional node deployment ({} fullnodes, {} blockstreamers) took {}",
                topology.getByRole(NodeRole.FULLNODE).size(),
                topology.getByRole(NodeRole.BLOCKSTREAMER).size(),
                followerTime);

        SanityResult sanity;
        try {
            sanity = verifySanity(topology, params.getSanityOptions());
        } catch (RuntimeException e) {
            abandonPending(topology);
            throw e;
        }

        stopwatch.reset().start();
        CompletableFuture<Void> clients = startClients(topology, artifacts, params, params.getStateMode(), context);
        Duration clientTime = stopwatch.elapsed();

        log.info("Deployment successful, version: {}, logs in {}", artifacts.getVersion(), runLogs.getDirectory());
        return DeploymentReport.builder()
                .networkVersion(artifacts.getVersion())
                .leaderDeployTime(leaderTime)
                .followerDeployTime(followerTime)
                .clientDeployTime(clientTime)
                .topology(topology)
                .sanity(sanity)
                .logDirectory(runLogs.getDirectory())
                .clientLaunches(clients)
                .build();
    }

    /**
     * Resolves the artifacts of a run. Nothing has been started when this fails, so every
     * record is closed.
     */
    private Artifacts resolve(DeploymentParams params) {
        try {
            return artifactResolver.resolve(params.getArtifactSource());
        } catch (RuntimeException e) {
            abandonPending(params.getTopology());
            throw e;
        }
    }

    private SanityResult verifySanity(ClusterTopology topology, SanityOptions options) {
        metrics.milestone(Milestone.SANITY_BEGIN);
        try {
            return sanityChecker.verify(sanityTarget(topology), topology.getServerCount(), options);
        } finally {
            metrics.milestone(Milestone.SANITY_COMPLETE);
        }
    }

    private void launchFollowers(ClusterTopology topology, Artifacts artifacts, DeploymentParams params,
                                 LaunchContext context) {
        LaunchLimiter limiter = new LaunchLimiter(
                params.getBurstSize(), params.getBurstPause(), params.getMaxInFlight(), pauser
        );

        Map<NodeRecord, CompletableFuture<Void>> launches = new LinkedHashMap<>();
        for (NodeRecord follower : topology.getFollowers()) {
            launches.put(follower, limiter.submit(() -> {
                lifecycle.start(follower, artifacts, params.getFullnodeConfig(), params.getStateMode(), context);
                return null;
            }, WORKERS));
        }

        List<NodeRecord> failed = new ArrayList<>();
        List<Throwable> causes = new ArrayList<>();
        launches.forEach((node, launch) -> {
            try {
                launch.join();
            } catch (CompletionException e) {
                failed.add(node);
                causes.add(e.getCause() == null ? e : e.getCause());
            }
        });

        if (failed.isEmpty()) {
            return;
        }

        surfaceLogs(failed);
        abandonPending(topology);
        throw new DeploymentException(
                failed.size() + " of " + launches.size() + " node launches failed",
                failed.stream().map(NodeRecord::getHost).collect(ImmutableList.toImmutableList()),
                failed.stream().map(NodeRecord::getLogFile).collect(ImmutableList.toImmutableList()),
                causes
        );
    }

    private CompletableFuture<Void> startClients(ClusterTopology topology, Artifacts artifacts,
                                                 DeploymentParams params, StateMode mode, LaunchContext context) {
        CompletableFuture<?>[] launches = topology.getClients().stream()
                .map(client -> CompletableFuture
                        .runAsync(() -> lifecycle.start(client, artifacts, params.getFullnodeConfig(), mode, context),
                                WORKERS)
                        .handle((result, error) -> {
                            if (error != null) {
                                log.error("Client {} failed to start, see {}", client.getHost(), client.getLogFile(),
                                        error);
                            }
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(launches);
    }

    /**
     * Closes the records of the nodes a failed run never got to.
     */
    private void abandonPending(ClusterTopology topology) {
        topology.getNodes().forEach(lifecycle::abandon);
    }

    private void surfaceLogs(List<NodeRecord> failed) {
        for (NodeRecord node : failed) {
            log.error("Start log of {} {} ({}):{}{}{}^^^ +++",
                    node.getRole().getLaunchName(), node.getHost(), node.getLogFile(),
                    System.lineSeparator(),
                    String.join(System.lineSeparator(), runLogs.tail(node)),
                    System.lineSeparator());
        }
    }

    /**
     * Sanity runs against the first fullnode, or the leader if the cluster has no other fullnode.
     */
    static NodeRecord sanityTarget(ClusterTopology topology) {
        return topology.getByRole(NodeRole.FULLNODE).stream()
                .findFirst()
                .orElse(topology.getBootstrapLeader());
    }

    /**
     * Nodes are told the number of fullnodes, the leader included.
     */
    private static LaunchContext launchContext(ClusterTopology topology) {
        return LaunchContext.builder()
                .entryPointHost(topology.getBootstrapLeader().getHost())
                .nodeCount(topology.getByRole(NodeRole.FULLNODE).size() + 1)
                .build();
    }
}
