package org.testnet.universe.remote;

/**
 * What happens to the state a previous run left on a node's host before a new launch.
 */
public enum StateMode {
    /**
     * Delete the previous state entirely.
     */
    RESET,
    /**
     * Keep the persisted per-node configuration (identity, ledger config) by relocating it out
     * of the way while everything else is wiped, then moving it back.
     */
    REUSE
}
