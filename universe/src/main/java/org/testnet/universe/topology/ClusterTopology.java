package org.testnet.universe.topology;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.testnet.universe.logging.RunLogs;
import org.testnet.universe.node.NodeRecord;
import org.testnet.universe.node.NodeRole;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Ordered collection of the {@link NodeRecord}s of one deployment run.
 * <p>
 * The order is the launch order: the bootstrap leader, then fullnodes, then blockstreamers,
 * then clients. A topology always has exactly one bootstrap leader and cannot be changed once
 * created; update-in-place derives a new topology holding the replacement records.
 */
@ToString
@EqualsAndHashCode
public class ClusterTopology {

    @Getter
    private final ImmutableList<NodeRecord> nodes;

    private ClusterTopology(List<NodeRecord> nodes) {
        long leaders = nodes.stream()
                .filter(node -> node.getRole() == NodeRole.BOOTSTRAP_LEADER)
                .count();
        if (leaders != 1) {
            throw new IllegalArgumentException(
                    "A topology needs exactly one bootstrap leader, found: " + leaders
            );
        }

        List<NodeRecord> ordered = new ArrayList<>();
        for (NodeRole role : NodeRole.values()) {
            nodes.stream()
                    .filter(node -> node.getRole() == role)
                    .forEach(ordered::add);
        }

        long distinctHosts = ordered.stream().map(NodeRecord::getHost).distinct().count();
        if (distinctHosts != ordered.size()) {
            throw new IllegalArgumentException("A host can only appear once in a topology: " + ordered);
        }

        this.nodes = ImmutableList.copyOf(ordered);
    }

    public static ClusterTopology of(@NonNull List<NodeRecord> nodes) {
        return new ClusterTopology(nodes);
    }

    public static TopologyBuilder builder(@NonNull RunLogs runLogs) {
        return new TopologyBuilder(runLogs);
    }

    public NodeRecord getBootstrapLeader() {
        return nodes.get(0);
    }

    /**
     * Fullnodes and blockstreamers that are launched after the bootstrap leader, in launch order.
     */
    public ImmutableList<NodeRecord> getFollowers() {
        return nodes.stream()
                .filter(node -> node.getRole() == NodeRole.FULLNODE || node.getRole() == NodeRole.BLOCKSTREAMER)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Every node that runs a fullnode process: the leader and all followers.
     */
    public ImmutableList<NodeRecord> getServers() {
        return nodes.stream()
                .filter(node -> !node.getRole().isClient())
                .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<NodeRecord> getClients() {
        return nodes.stream()
                .filter(node -> node.getRole().isClient())
                .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<NodeRecord> getByRole(NodeRole role) {
        return nodes.stream()
                .filter(node -> node.getRole() == role)
                .collect(ImmutableList.toImmutableList());
    }

    /**
     * Number of fullnode processes (leader, fullnodes and blockstreamers) the cluster should have.
     */
    public int getServerCount() {
        return getServers().size();
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Derives a new topology in which every record is mapped by the given function.
     */
    public ClusterTopology map(UnaryOperator<NodeRecord> mapper) {
        return new ClusterTopology(nodes.stream().map(mapper).collect(Collectors.toList()));
    }

    /**
     * Builds a topology from host lists, the way a testnet configuration describes it: the first
     * fullnode host is the bootstrap leader.
     */
    public static class TopologyBuilder {
        private final RunLogs runLogs;
        private final List<NodeRecord> nodes = new ArrayList<>();

        private TopologyBuilder(RunLogs runLogs) {
            this.runLogs = runLogs;
        }

        public TopologyBuilder node(NodeRole role, String host) {
            nodes.add(new NodeRecord(host, role, runLogs.nodeLog(role, host)));
            return this;
        }

        public TopologyBuilder fullnodes(List<String> hosts) {
            for (int i = 0; i < hosts.size(); i++) {
                node(i == 0 ? NodeRole.BOOTSTRAP_LEADER : NodeRole.FULLNODE, hosts.get(i));
            }
            return this;
        }

        public TopologyBuilder blockstreamers(List<String> hosts) {
            hosts.forEach(host -> node(NodeRole.BLOCKSTREAMER, host));
            return this;
        }

        public TopologyBuilder clients(List<String> hosts) {
            hosts.forEach(host -> node(NodeRole.CLIENT, host));
            return this;
        }

        public ClusterTopology build() {
            return new ClusterTopology(nodes);
        }
    }
}
