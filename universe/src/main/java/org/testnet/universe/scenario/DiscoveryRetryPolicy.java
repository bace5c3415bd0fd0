package org.testnet.universe.scenario;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.discovery.DiscoveredSet;
import org.testnet.universe.discovery.GossipDiscovery;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.util.Pauser;

import java.time.Duration;

/**
 * Repeats discovery for callers that need the full membership. Discovery itself never
 * retries; this policy makes the number of attempts and the pause between them explicit.
 */
@Slf4j
@Builder(toBuilder = true)
@Getter
@ToString
public class DiscoveryRetryPolicy {

    public static final DiscoveryRetryPolicy DEFAULT = DiscoveryRetryPolicy.builder().build();

    @Default
    private final int attempts = 5;

    @Default
    @NonNull
    private final Duration backoff = Duration.ofSeconds(1);

    @Default
    @NonNull
    @ToString.Exclude
    private final Pauser pauser = Pauser.SLEEP;

    /**
     * Discovers until the expected count is found or the attempts are used up.
     *
     * @return the first complete set, otherwise the largest set seen
     */
    public DiscoveredSet discover(GossipDiscovery discovery, ContactInfo entryPoint, int expectedCount) {
        Preconditions.checkArgument(attempts > 0, "At least one attempt is needed: %s", attempts);

        DiscoveredSet best = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            DiscoveredSet discovered = discovery.discover(entryPoint, expectedCount);
            if (best == null || discovered.size() > best.size()) {
                best = discovered;
            }
            if (discovered.isComplete()) {
                return discovered;
            }

            log.info("Discovery attempt {}/{} found {} of {} nodes", attempt, attempts, discovered.size(), expectedCount);
            if (attempt < attempts) {
                pauser.pause(backoff);
            }
        }
        return best;
    }
}
