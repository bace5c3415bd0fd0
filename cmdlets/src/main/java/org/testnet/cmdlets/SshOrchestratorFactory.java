package org.testnet.cmdlets;

import org.testnet.universe.artifact.ArtifactResolver;
import org.testnet.universe.artifact.HttpReleaseDownloader;
import org.testnet.universe.deploy.DeploymentOrchestrator;
import org.testnet.universe.discovery.GossipDiscovery;
import org.testnet.universe.discovery.RpcGossipSource;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.node.NodeLifecycleController;
import org.testnet.universe.remote.CommandRunner;
import org.testnet.universe.remote.LocalCommandRunner;
import org.testnet.universe.remote.RemoteHostFactory;
import org.testnet.universe.remote.SshRemoteHost;
import org.testnet.universe.rpc.HttpJsonRpcTransport;
import org.testnet.universe.sanity.SanityChecker;

/**
 * Wires an orchestrator that reaches the configured hosts over ssh and their control planes
 * over http.
 */
public class SshOrchestratorFactory implements OrchestratorFactory {

    @Override
    public DeploymentOrchestrator create(NetConfig config, RunLogs runLogs) {
        CommandRunner commandRunner = new LocalCommandRunner();
        RemoteHostFactory remoteHosts = SshRemoteHost.factory(config.toSshParams(), commandRunner);
        HttpJsonRpcTransport transport = new HttpJsonRpcTransport();

        NodeLifecycleController lifecycle = NodeLifecycleController.builder()
                .remoteHosts(remoteHosts)
                .runLogs(runLogs)
                .params(config.toLifecycleParams())
                .build();

        SanityChecker sanityChecker = SanityChecker.builder()
                .remoteHosts(remoteHosts)
                .transport(transport)
                .discovery(new GossipDiscovery(new RpcGossipSource(transport), config.toDiscoveryParams()))
                .ports(config.toServicePorts())
                .params(config.toSanityParams())
                .build();

        ArtifactResolver artifactResolver = ArtifactResolver.builder()
                .params(config.toArtifactParams())
                .commandRunner(commandRunner)
                .downloader(new HttpReleaseDownloader())
                .build();

        return DeploymentOrchestrator.builder()
                .artifactResolver(artifactResolver)
                .lifecycle(lifecycle)
                .sanityChecker(sanityChecker)
                .remoteHosts(remoteHosts)
                .runLogs(runLogs)
                .build();
    }
}
