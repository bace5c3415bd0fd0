package org.testnet.universe.topology;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Boot time configuration of every fullnode of a deployment.
 * <p>
 * The configuration is rendered into launcher flags when a node starts and is fixed from then
 * on: there is no way to enable an rpc surface on a running node. A scenario that needs one
 * of the optional surfaces must be run against a cluster booted with it enabled.
 * All optional surfaces are disabled by default.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class FullnodeConfig {
    public static final FullnodeConfig DEFAULT = FullnodeConfig.builder().build();

    static final String FLAG_FULLNODE_EXIT = "--enable-rpc-exit";
    static final String FLAG_GOSSIP_PUSH = "--enable-rpc-gossip-push";
    static final String FLAG_GOSSIP_REFRESH_ACTIVE_SET = "--enable-rpc-gossip-refresh-active-set";

    /**
     * Allows the fullnodeExit rpc to terminate the node.
     */
    @Default
    private final boolean fullnodeExitEnabled = false;

    /**
     * Allows the pushGossipEntry rpc to inject records into the node's gossip table.
     */
    @Default
    private final boolean rpcGossipPushEnabled = false;

    /**
     * Allows the refreshActiveSet rpc to force re-selection of active gossip peers.
     */
    @Default
    private final boolean rpcGossipRefreshActiveSetEnabled = false;

    /**
     * Nodes can hand over leadership, which update-in-place relies on.
     */
    @Default
    private final boolean leaderRotation = false;

    /**
     * Nodes advertise their public rather than their private addresses.
     */
    @Default
    private final boolean publicNetwork = false;

    /**
     * The launcher flags enabling the optional rpc surfaces of this configuration.
     */
    public ImmutableList<String> surfaceFlags() {
        ImmutableList.Builder<String> flags = ImmutableList.builder();
        if (fullnodeExitEnabled) {
            flags.add(FLAG_FULLNODE_EXIT);
        }
        if (rpcGossipPushEnabled) {
            flags.add(FLAG_GOSSIP_PUSH);
        }
        if (rpcGossipRefreshActiveSetEnabled) {
            flags.add(FLAG_GOSSIP_REFRESH_ACTIVE_SET);
        }
        return flags.build();
    }
}
