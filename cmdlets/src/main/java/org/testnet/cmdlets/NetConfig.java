package org.testnet.cmdlets;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonParseException;
import lombok.Getter;
import lombok.ToString;
import org.testnet.universe.artifact.ArtifactParams;
import org.testnet.universe.deploy.LaunchLimiter;
import org.testnet.universe.discovery.DiscoveryParams;
import org.testnet.universe.logging.LoggingParams;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.node.LifecycleParams;
import org.testnet.universe.remote.SshParams;
import org.testnet.universe.sanity.SanityParams;
import org.testnet.universe.topology.ClusterTopology;
import org.testnet.universe.topology.FullnodeConfig;
import org.testnet.universe.topology.ServicePorts;
import org.testnet.universe.universe.UniverseException;
import org.testnet.universe.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Testnet configuration file of the net tool, read from JSON. Every setting has a default
 * except the host lists.
 */
@Getter
@ToString
public class NetConfig {

    private List<String> fullnodes = new ArrayList<>();
    private List<String> blockstreamers = new ArrayList<>();
    private List<String> clients = new ArrayList<>();

    private boolean publicNetwork = false;
    private Surfaces fullnodeConfig = new Surfaces();
    private Ports ports = new Ports();
    private Ssh ssh = new Ssh();

    private String netLogDir = "net/log";
    private String verbosityVariable = LoggingParams.DEFAULT_VERBOSITY_VARIABLE;

    private String projectRoot = ".";
    private List<String> buildCommand;
    private String releaseUrlTemplate;
    private List<String> supportFiles;

    private String nodeLauncher;
    private String clientLauncher;
    private List<String> fallbackProcessPatterns;
    private List<String> auxiliaryPidFiles;

    private int burstSize = LaunchLimiter.DEFAULT_BURST_SIZE;
    private long burstPauseMillis = LaunchLimiter.DEFAULT_BURST_PAUSE.toMillis();
    /**
     * 0 for no limit.
     */
    private int maxInFlight = 0;

    private List<String> ledgerVerifyCommand;
    private long discoveryWindowMillis = DiscoveryParams.DEFAULT_WINDOW.toMillis();

    /**
     * Reads a configuration file.
     *
     * @throws IllegalArgumentException if the file is not a valid configuration
     * @throws UniverseException        if the file can't be read
     */
    public static NetConfig load(Path file) {
        String json;
        try {
            json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UniverseException("Can't read configuration file: " + file, e);
        }
        return parse(json);
    }

    public static NetConfig parse(String json) {
        NetConfig config;
        try {
            config = JsonUtils.fromJson(json, NetConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }

        if (config == null || config.fullnodes == null || config.fullnodes.isEmpty()) {
            throw new IllegalArgumentException("Invalid configuration: no fullnodes configured");
        }
        return config;
    }

    public ClusterTopology topology(RunLogs runLogs) {
        return ClusterTopology.builder(runLogs)
                .fullnodes(fullnodes)
                .blockstreamers(nullToEmpty(blockstreamers))
                .clients(nullToEmpty(clients))
                .build();
    }

    public FullnodeConfig toFullnodeConfig() {
        return FullnodeConfig.builder()
                .fullnodeExitEnabled(fullnodeConfig.fullnodeExit)
                .rpcGossipPushEnabled(fullnodeConfig.rpcGossipPush)
                .rpcGossipRefreshActiveSetEnabled(fullnodeConfig.rpcGossipRefreshActiveSet)
                .leaderRotation(fullnodeConfig.leaderRotation)
                .publicNetwork(publicNetwork)
                .build();
    }

    public ServicePorts toServicePorts() {
        return ServicePorts.builder()
                .gossipPort(ports.gossip)
                .rpcPort(ports.rpc)
                .dronePort(ports.drone)
                .build();
    }

    public SshParams toSshParams() {
        SshParams.SshParamsBuilder params = SshParams.builder()
                .user(ssh.user)
                .identityFile(ssh.identityFile)
                .options(nullToEmpty(ssh.options))
                .connectTimeout(Duration.ofSeconds(ssh.connectTimeoutSeconds))
                .sudoKill(ssh.sudoKill);
        if (ssh.projectDir != null) {
            params.projectDir(ssh.projectDir);
        }
        if (ssh.binDir != null) {
            params.binDir(ssh.binDir);
        }
        return params.build();
    }

    public ArtifactParams toArtifactParams() {
        ArtifactParams.ArtifactParamsBuilder params = ArtifactParams.builder()
                .projectRoot(Paths.get(projectRoot));
        if (buildCommand != null) {
            params.buildCommand(ImmutableList.copyOf(buildCommand));
        }
        if (releaseUrlTemplate != null) {
            params.releaseUrlTemplate(releaseUrlTemplate);
        }
        if (supportFiles != null) {
            params.supportFiles(ImmutableList.copyOf(supportFiles));
        }
        return params.build();
    }

    public LifecycleParams toLifecycleParams() {
        LifecycleParams.LifecycleParamsBuilder params = LifecycleParams.builder();
        if (nodeLauncher != null) {
            params.nodeLauncher(nodeLauncher);
        }
        if (clientLauncher != null) {
            params.clientLauncher(clientLauncher);
        }
        if (fallbackProcessPatterns != null) {
            params.fallbackPatterns(ImmutableList.copyOf(fallbackProcessPatterns));
        }
        if (auxiliaryPidFiles != null) {
            params.auxiliaryPidFiles(ImmutableList.copyOf(auxiliaryPidFiles));
        }
        return params.build();
    }

    public SanityParams toSanityParams() {
        SanityParams.SanityParamsBuilder params = SanityParams.builder();
        if (ledgerVerifyCommand != null) {
            params.ledgerVerifyCommand(ImmutableList.copyOf(ledgerVerifyCommand));
        }
        return params.build();
    }

    public DiscoveryParams toDiscoveryParams() {
        return DiscoveryParams.builder()
                .window(Duration.ofMillis(discoveryWindowMillis))
                .build();
    }

    /**
     * Logging params of the run, picking the log verbosity up from the environment.
     */
    public LoggingParams toLoggingParams() {
        return LoggingParams.fromEnvironment(Paths.get(netLogDir), verbosityVariable);
    }

    public int effectiveMaxInFlight() {
        return maxInFlight <= 0 ? LaunchLimiter.UNBOUNDED : maxInFlight;
    }

    private static List<String> nullToEmpty(List<String> list) {
        return list == null ? ImmutableList.of() : list;
    }

    /**
     * Optional rpc surfaces enabled at boot.
     */
    @Getter
    @ToString
    public static class Surfaces {
        private boolean fullnodeExit = false;
        private boolean rpcGossipPush = false;
        private boolean rpcGossipRefreshActiveSet = false;
        private boolean leaderRotation = false;
    }

    @Getter
    @ToString
    public static class Ports {
        private int gossip = ServicePorts.DEFAULT.getGossipPort();
        private int rpc = ServicePorts.DEFAULT.getRpcPort();
        private int drone = ServicePorts.DEFAULT.getDronePort();
    }

    @Getter
    @ToString
    public static class Ssh {
        private String user;
        private String identityFile;
        private List<String> options;
        private long connectTimeoutSeconds = 10;
        private String projectDir;
        private String binDir;
        private boolean sudoKill = false;
    }
}
