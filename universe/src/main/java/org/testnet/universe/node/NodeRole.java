package org.testnet.universe.node;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The part a node plays in a deployment.
 */
@AllArgsConstructor
public enum NodeRole {
    BOOTSTRAP_LEADER("bootstrap-leader", "fullnode"),
    FULLNODE("fullnode", "fullnode"),
    BLOCKSTREAMER("blockstreamer", "fullnode"),
    CLIENT("client", "client");

    /**
     * Name passed to the remote launcher and used in log file names.
     */
    @Getter
    private final String launchName;

    /**
     * Name of the log the node writes on its own host.
     */
    @Getter
    private final String remoteLogName;

    public boolean isClient() {
        return this == CLIENT;
    }
}
