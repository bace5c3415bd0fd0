package org.testnet.universe.scenario;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import org.testnet.universe.discovery.DiscoveredSet;
import org.testnet.universe.discovery.GossipDiscovery;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.rpc.ControlPlaneClient;
import org.testnet.universe.rpc.JsonRpcTransport;
import org.testnet.universe.util.Pauser;

import java.time.Duration;

/**
 * What a scenario uses to reach a cluster: discovery, control plane clients and a clock.
 * A harness is independent of how the cluster runs, so one scenario body works against an
 * in-process cluster as well as a deployed one.
 */
@Builder
public class ScenarioHarness {

    @NonNull
    private final JsonRpcTransport transport;

    @Getter
    @NonNull
    private final GossipDiscovery discovery;

    @Getter
    @Default
    @NonNull
    private final DiscoveryRetryPolicy retryPolicy = DiscoveryRetryPolicy.DEFAULT;

    /**
     * How long a submitted transaction may take to confirm.
     */
    @Getter
    @Default
    @NonNull
    private final Duration confirmationTimeout = Duration.ofSeconds(30);

    @Getter
    @Default
    @NonNull
    private final Duration confirmationPollInterval = Duration.ofMillis(500);

    @Getter
    @Default
    @NonNull
    private final Pauser pauser = Pauser.SLEEP;

    public ControlPlaneClient controlPlane(ContactInfo node) {
        return ControlPlaneClient.forNode(node, transport);
    }

    /**
     * Discovers the cluster, retrying according to the retry policy.
     */
    public DiscoveredSet discoverAll(ContactInfo entryPoint, int nodeCount) {
        return retryPolicy.discover(discovery, entryPoint, nodeCount);
    }

    public void pause(Duration duration) {
        pauser.pause(duration);
    }
}
