package org.testnet.universe.sanity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.discovery.DiscoveredSet;
import org.testnet.universe.discovery.GossipDiscovery;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.NodeRecord;
import org.testnet.universe.remote.CommandResult;
import org.testnet.universe.remote.RemoteHostFactory;
import org.testnet.universe.rpc.ControlPlaneClient;
import org.testnet.universe.rpc.HealthStatus;
import org.testnet.universe.rpc.JsonRpcTransport;
import org.testnet.universe.topology.ServicePorts;
import org.testnet.universe.universe.UniverseException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the post-boot battery against one running node: ledger verification, fullnode
 * liveness and the node count seen through gossip.
 * <p>
 * Checks are independent: a skipped or failed check never affects whether another one runs.
 * The checker only reads; it never stops a node.
 */
@Slf4j
@Builder
public class SanityChecker {

    @NonNull
    private final RemoteHostFactory remoteHosts;

    @NonNull
    private final JsonRpcTransport transport;

    @NonNull
    private final GossipDiscovery discovery;

    @Default
    @NonNull
    private final ServicePorts ports = ServicePorts.DEFAULT;

    @Default
    @NonNull
    private final SanityParams params = SanityParams.DEFAULT;

    /**
     * Runs the battery.
     *
     * @param node              the node to check
     * @param expectedNodeCount number of fullnodes the cluster should have
     */
    public SanityResult check(@NonNull NodeRecord node, int expectedNodeCount, @NonNull SanityOptions options) {
        log.info("Sanity check of {}: {}", node.getHost(), options);

        ImmutableList.Builder<SanityCheck> passed = ImmutableList.builder();
        ImmutableList.Builder<SanityCheck> skipped = ImmutableList.builder();
        Map<SanityCheck, String> failures = new LinkedHashMap<>();
        ContactInfo contact = node.contact(ports);

        if (options.isSkipLedgerVerify()) {
            skipped.add(SanityCheck.LEDGER_VERIFY);
        } else {
            run(SanityCheck.LEDGER_VERIFY, () -> verifyLedger(node), passed, failures);
        }

        if (options.isSkipValidatorSanity()) {
            skipped.add(SanityCheck.VALIDATOR_SANITY);
        } else {
            run(SanityCheck.VALIDATOR_SANITY, () -> checkLiveness(contact), passed, failures);
        }

        run(SanityCheck.NODE_COUNT, () -> checkNodeCount(contact, expectedNodeCount, options.isRejectExtraNodes()),
                passed, failures);

        SanityResult result = new SanityResult(node.getHost(), passed.build(), skipped.build(),
                ImmutableMap.copyOf(failures));
        if (result.isPassed()) {
            log.info("Sanity check of {} passed: {}", node.getHost(), result.getPassed());
        } else {
            log.error("Sanity check of {} failed: {}", node.getHost(), result.getFailures());
        }
        return result;
    }

    /**
     * Runs the battery and fails on any failed check.
     *
     * @throws SanityException if a check failed
     */
    public SanityResult verify(NodeRecord node, int expectedNodeCount, SanityOptions options) {
        SanityResult result = check(node, expectedNodeCount, options);
        if (!result.isPassed()) {
            throw new SanityException(result);
        }
        return result;
    }

    private void verifyLedger(NodeRecord node) {
        CommandResult result = remoteHosts.forHost(node.getHost())
                .execute(params.getLedgerVerifyCommand(), params.getLedgerVerifyTimeout());
        if (!result.isSuccess()) {
            throw new UniverseException("ledger verification exited with " + result.getExitCode()
                    + ": " + result.getOutput());
        }
    }

    private void checkLiveness(ContactInfo contact) {
        ControlPlaneClient client = ControlPlaneClient.forNode(contact, transport);
        HealthStatus health = client.getHealth();
        if (!health.isOk()) {
            throw new UniverseException("fullnode health is " + health);
        }

        long transactionCount = client.getTransactionCount();
        log.debug("Transaction count of {}: {}", contact.getRpcAddress(), transactionCount);
    }

    private void checkNodeCount(ContactInfo contact, int expectedNodeCount, boolean rejectExtraNodes) {
        int lookFor = rejectExtraNodes ? expectedNodeCount + 1 : expectedNodeCount;
        DiscoveredSet discovered = discovery.discover(contact, lookFor);

        if (discovered.size() < expectedNodeCount) {
            throw new UniverseException("found " + discovered.size() + " of " + expectedNodeCount + " nodes");
        }
        if (rejectExtraNodes && discovered.size() > expectedNodeCount) {
            throw new UniverseException("found more than the expected " + expectedNodeCount + " nodes");
        }
    }

    private void run(SanityCheck check, Runnable body, ImmutableList.Builder<SanityCheck> passed,
                     Map<SanityCheck, String> failures) {
        try {
            body.run();
            passed.add(check);
        } catch (RuntimeException e) {
            log.warn("Sanity check {} failed", check, e);
            failures.put(check, String.valueOf(e.getMessage()));
        }
    }
}
