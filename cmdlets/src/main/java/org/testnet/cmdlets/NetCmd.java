package org.testnet.cmdlets;

import lombok.extern.slf4j.Slf4j;
import org.docopt.DocoptExitException;
import org.testnet.universe.deploy.DeploymentOrchestrator;
import org.testnet.universe.deploy.DeploymentParams;
import org.testnet.universe.deploy.DeploymentReport;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.remote.StateMode;
import org.testnet.universe.topology.ClusterTopology;
import org.testnet.universe.universe.UniverseException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * The net tool: operates a configured testnet.
 * <p>
 * Exits with 0 on success and with 1 on any detected failure: invalid arguments or
 * configuration, artifact resolution, a failed launch, a failed sanity check, or an update
 * of a cluster without leader rotation.
 */
@Slf4j
public class NetCmd {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;

    private final OrchestratorFactory orchestratorFactory;

    public NetCmd(OrchestratorFactory orchestratorFactory) {
        this.orchestratorFactory = orchestratorFactory;
    }

    public static void main(String[] args) {
        System.exit(new NetCmd(new SshOrchestratorFactory()).run(args));
    }

    /**
     * Runs the tool.
     *
     * @return the exit code
     */
    public int run(String... args) {
        NetCmdLine cmdLine;
        try {
            cmdLine = NetCmdLine.parse(args);
        } catch (DocoptExitException e) {
            println(e.getMessage() == null ? NetCmdLine.USAGE : e.getMessage());
            return e.getExitCode() == 0 ? EXIT_OK : EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            println("Error: " + e.getMessage());
            println(NetCmdLine.USAGE);
            return EXIT_FAILURE;
        }

        try {
            NetConfig config = NetConfig.load(cmdLine.getConfigFile());
            execute(cmdLine, config);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            log.error("Error: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (UniverseException e) {
            log.error("net {} failed", cmdLine.getCommand().getName(), e);
            return EXIT_FAILURE;
        }
    }

    private void execute(NetCmdLine cmdLine, NetConfig config) {
        RunLogs runLogs = new RunLogs(config.toLoggingParams());
        DeploymentOrchestrator orchestrator = orchestratorFactory.create(config, runLogs);
        ClusterTopology topology = config.topology(runLogs);

        DeploymentParams params = DeploymentParams.builder()
                .topology(topology)
                .fullnodeConfig(config.toFullnodeConfig())
                .artifactSource(cmdLine.getArtifactSource())
                .stateMode(cmdLine.isReuse() || cmdLine.getCommand() == NetCommand.UPDATE
                        ? StateMode.REUSE
                        : StateMode.RESET)
                .sanityOptions(cmdLine.getSanityOptions())
                .burstSize(config.getBurstSize())
                .burstPause(Duration.ofMillis(config.getBurstPauseMillis()))
                .maxInFlight(config.effectiveMaxInFlight())
                .build();

        switch (cmdLine.getCommand()) {
            case START:
                report(orchestrator.start(params));
                break;
            case UPDATE:
                report(orchestrator.update(params));
                break;
            case RESTART:
                report(orchestrator.restart(params));
                break;
            case STOP:
                orchestrator.stop(topology);
                break;
            case SANITY:
                orchestrator.sanity(params);
                break;
            case LOGS:
                List<Path> logs = orchestrator.fetchLogs(topology);
                log.info("Fetched {} logs into {}", logs.size(), runLogs.getDirectory());
                break;
            default:
                throw new IllegalStateException("Unknown command: " + cmdLine.getCommand());
        }
    }

    private static void report(DeploymentReport report) {
        // the JVM exits right after, which would cut client launches short
        report.getClientLaunches().join();

        ClusterTopology topology = report.getTopology();
        log.info("+++ Deployment Successful, version: {}", report.getNetworkVersion());
        log.info("Bootstrap leader deployment took {} seconds", report.getLeaderDeployTime().getSeconds());
        log.info("Additional fullnode deployment ({} nodes) took {} seconds",
                topology.getFollowers().size(), report.getFollowerDeployTime().getSeconds());
        log.info("Client deployment ({} instances) took {} seconds",
                topology.getClients().size(), report.getClientDeployTime().getSeconds());
        log.info("Network start logs in {}", report.getLogDirectory());
    }

    /**
     * Print to the console, followed by a newline.
     */
    @SuppressWarnings("checkstyle:printLine")
    private static void println(String line) {
        System.out.println(line);
    }
}
