package org.testnet.universe.scenario;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.discovery.DiscoveredSet;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;
import org.testnet.universe.rpc.ControlPlaneClient;

import java.time.Duration;

/**
 * Scenarios bundled with the harness.
 */
@Slf4j
public final class ClusterScenarios {

    public static final String GOSSIP_FLOOD_LIVENESS = "gossipFloodLiveness";
    public static final String SPEND_AND_VERIFY_ALL_NODES = "spendAndVerifyAllNodes";
    public static final String DISCOVER_ALL_NODES = "discoverAllNodes";

    /**
     * Malformed gossip entries pushed per cluster node.
     */
    public static final int FLOOD_ENTRIES_PER_NODE = 100;

    static final Duration FLOOD_SETTLE_TIME = Duration.ofSeconds(1);

    private ClusterScenarios() {
        // prevent instantiation of this class
    }

    public static ImmutableMap<String, ClusterScenario> all() {
        return ImmutableMap.of(
                DISCOVER_ALL_NODES, discoverAllNodes(),
                SPEND_AND_VERIFY_ALL_NODES, spendAndVerifyAllNodes(),
                GOSSIP_FLOOD_LIVENESS, gossipFloodLiveness()
        );
    }

    /**
     * Discovery through the entry point eventually finds every node.
     * Needs nothing enabled on the nodes.
     */
    public static ClusterScenario discoverAllNodes() {
        return (harness, entryPoint, funder, nodeCount) -> discoverCluster(harness, entryPoint, nodeCount);
    }

    /**
     * Every node accepts and confirms a spend.
     */
    public static ClusterScenario spendAndVerifyAllNodes() {
        return (harness, entryPoint, funder, nodeCount) -> {
            DiscoveredSet cluster = discoverCluster(harness, entryPoint, nodeCount);
            for (ContactInfo node : cluster.getMembers()) {
                ScenarioUtils.transferAndConfirm(harness, harness.controlPlane(node), funder, 1);
            }
        };
    }

    /**
     * The cluster stays live while its gossip tables are flooded with malformed entries: pushes
     * {@code nodeCount * 100} bad entries into the entry point, forces every node to re-select
     * its active set, then requires a one lamport transfer to confirm.
     * <p>
     * The nodes must be booted with gossip push and active set refresh enabled.
     */
    public static ClusterScenario gossipFloodLiveness() {
        return (harness, entryPoint, funder, nodeCount) -> {
            DiscoveredSet cluster = discoverCluster(harness, entryPoint, nodeCount);
            ControlPlaneClient entry = harness.controlPlane(entryPoint);

            int floodSize = nodeCount * FLOOD_ENTRIES_PER_NODE;
            log.info("Pushing {} malformed gossip entries to {}", floodSize, entry.getEndpoint());
            for (int i = 0; i < floodSize; i++) {
                entry.pushGossipEntry(malformedEntry(i));
            }

            harness.pause(FLOOD_SETTLE_TIME);

            for (ContactInfo node : cluster.getMembers()) {
                harness.controlPlane(node).refreshActiveSet();
            }

            ScenarioUtils.transferAndConfirm(harness, entry, funder, 1);
        };
    }

    /**
     * A gossip entry no node can connect to. The kinds of damage rotate so that every
     * validation path of the receiving node is exercised.
     */
    static ContactRecord malformedEntry(int index) {
        String id = "malformed-" + index;
        switch (index % 4) {
            case 0:
                return new ContactRecord(id, "0.0.0.0:0", "0.0.0.0:0");
            case 1:
                return new ContactRecord(id, "not an address", "not an address");
            case 2:
                return new ContactRecord(id, "127.0.0.1", null);
            default:
                return new ContactRecord(id, "10.0.0.1:70000", "10.0.0.1:-1");
        }
    }

    private static DiscoveredSet discoverCluster(ScenarioHarness harness, ContactInfo entryPoint, int nodeCount) {
        DiscoveredSet cluster = harness.discoverAll(entryPoint, nodeCount);
        if (cluster.size() < nodeCount) {
            throw new ScenarioException("Discovered " + cluster.size() + " of " + nodeCount + " nodes: "
                    + cluster.getMembers());
        }
        return cluster;
    }
}
