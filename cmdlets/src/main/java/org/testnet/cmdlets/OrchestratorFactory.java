package org.testnet.cmdlets;

import org.testnet.universe.deploy.DeploymentOrchestrator;
import org.testnet.universe.logging.RunLogs;

/**
 * Creates the deployment orchestrator the net tool drives.
 */
@FunctionalInterface
public interface OrchestratorFactory {

    DeploymentOrchestrator create(NetConfig config, RunLogs runLogs);
}
