package org.testnet.universe.scenario;

import org.testnet.universe.node.ContactInfo;

/**
 * A self-contained fault injection test against one cluster.
 * <p>
 * The body depends on nothing but its arguments: it discovers the cluster through the entry
 * point, drives it through the harness' control plane and fails by throwing when an invariant
 * does not hold. A scenario must not rely on running before or after another scenario and
 * must not require the cluster to be cleaned up after it.
 */
@FunctionalInterface
public interface ClusterScenario {

    void run(ScenarioHarness harness, ContactInfo entryPoint, FundedCredential funder, int nodeCount);
}
