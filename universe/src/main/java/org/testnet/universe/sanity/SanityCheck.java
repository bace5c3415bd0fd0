package org.testnet.universe.sanity;

/**
 * The checks of the post-boot battery.
 */
public enum SanityCheck {
    /**
     * The node's ledger verifies.
     */
    LEDGER_VERIFY,
    /**
     * The fullnode is healthy and serves its rpc.
     */
    VALIDATOR_SANITY,
    /**
     * Discovery through the node finds the expected number of nodes.
     */
    NODE_COUNT
}
