package org.testnet.cmdlets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testnet.universe.logging.LoggingParams;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.node.NodeRole;
import org.testnet.universe.remote.SshParams;
import org.testnet.universe.topology.ClusterTopology;
import org.testnet.universe.topology.FullnodeConfig;
import org.testnet.universe.universe.UniverseException;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void loadsConfiguration() throws URISyntaxException {
        NetConfig config = NetConfig.load(Paths.get(getClass().getResource("/net-config.json").toURI()));

        ClusterTopology topology = config.topology(new RunLogs(LoggingParams.builder().logDir(tempDir).build()));
        assertThat(topology.getBootstrapLeader().getHost()).isEqualTo("10.0.0.1");
        assertThat(topology.getByRole(NodeRole.FULLNODE)).hasSize(2);
        assertThat(topology.getByRole(NodeRole.BLOCKSTREAMER)).hasSize(1);
        assertThat(topology.getClients()).hasSize(1);

        FullnodeConfig fullnodeConfig = config.toFullnodeConfig();
        assertThat(fullnodeConfig.isPublicNetwork()).isTrue();
        assertThat(fullnodeConfig.isRpcGossipPushEnabled()).isTrue();
        assertThat(fullnodeConfig.isRpcGossipRefreshActiveSetEnabled()).isTrue();
        assertThat(fullnodeConfig.isFullnodeExitEnabled()).isFalse();
        assertThat(fullnodeConfig.isLeaderRotation()).isFalse();

        assertThat(config.toServicePorts().getRpcPort()).isEqualTo(18899);
        assertThat(config.toServicePorts().getGossipPort()).isEqualTo(8001);

        SshParams ssh = config.toSshParams();
        assertThat(ssh.target("10.0.0.1")).isEqualTo("testnet@10.0.0.1");
        assertThat(ssh.sshOptions()).contains("ServerAliveInterval=30", "id_testnet");
        assertThat(ssh.getProjectDir()).isEqualTo("testnet");

        assertThat(config.getBurstSize()).isEqualTo(3);
        assertThat(config.getBurstPauseMillis()).isEqualTo(500);
        assertThat(config.effectiveMaxInFlight()).isEqualTo(Integer.MAX_VALUE);
        assertThat(config.toLifecycleParams().getFallbackPatterns()).containsExactly("solana-");
        assertThat(config.toLifecycleParams().getAuxiliaryPidFiles()).containsExactly("monitor.pid");
        assertThat(config.toLifecycleParams().getNodeLauncher()).isEqualTo("net/remote/remote-node.sh");
    }

    @Test
    public void defaultsForOmittedSettings() {
        NetConfig config = NetConfig.parse("{\"fullnodes\": [\"10.0.0.1\"]}");

        assertThat(config.toFullnodeConfig()).isEqualTo(FullnodeConfig.DEFAULT);
        assertThat(config.toArtifactParams().getBuildCommand()).containsExactly("scripts/cargo-install-all.sh", "farf");
        assertThat(config.toSanityParams().getLedgerVerifyCommand()).isNotEmpty();
        assertThat(config.toDiscoveryParams().getWindow().getSeconds()).isEqualTo(3);
        assertThat(config.toLoggingParams().getLogDir()).isEqualTo(Paths.get("net/log"));
        assertThat(config.toLifecycleParams().getAuxiliaryPidFiles()).containsExactly("net-stats.pid", "oom-monitor.pid");
    }

    @Test
    public void fullnodesAreRequired() {
        assertThatThrownBy(() -> NetConfig.parse("{\"clients\": [\"10.0.1.1\"]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fullnodes");
        assertThatThrownBy(() -> NetConfig.parse("{\"fullnodes\": [\"10.0.0.1\"")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void unreadableFile() {
        assertThatThrownBy(() -> NetConfig.load(tempDir.resolve("missing.json")))
                .isInstanceOf(UniverseException.class);
    }
}
