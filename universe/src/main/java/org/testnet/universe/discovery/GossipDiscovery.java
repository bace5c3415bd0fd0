package org.testnet.universe.discovery;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Collects a best-effort snapshot of the cluster membership through one entry point.
 * <p>
 * A discovery polls the gossip session until either the expected number of valid, distinct
 * members is found or the window expires. The window is fixed: a slow entry point or a flood
 * of records can't extend it, and nothing but its expiry cancels a discovery. A partial result
 * is a normal outcome, reported through {@link DiscoveredSet#isWindowExpired()}.
 */
@Slf4j
public class GossipDiscovery {

    private static final ExecutorService POLLERS = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("gossip-poll-%d")
                    .build()
    );

    private final GossipSource source;
    private final DiscoveryParams params;

    public GossipDiscovery(@NonNull GossipSource source, @NonNull DiscoveryParams params) {
        this.source = source;
        this.params = params;
    }

    public GossipDiscovery(GossipSource source) {
        this(source, DiscoveryParams.DEFAULT);
    }

    public DiscoveredSet discover(ContactInfo entryPoint, int expectedCount) {
        return discover(entryPoint, expectedCount, params.getWindow());
    }

    /**
     * Discovers at most {@code expectedCount} members within {@code window}.
     */
    public DiscoveredSet discover(@NonNull ContactInfo entryPoint, int expectedCount, @NonNull Duration window) {
        Preconditions.checkArgument(expectedCount >= 0, "Negative expected count: %s", expectedCount);
        Preconditions.checkArgument(!window.isNegative(), "Negative discovery window: %s", window);

        Stopwatch stopwatch = Stopwatch.createStarted(params.getTicker());
        Map<String, ContactInfo> members = new LinkedHashMap<>();

        if (expectedCount == 0) {
            return new DiscoveredSet(ImmutableList.of(), 0, false, stopwatch.elapsed());
        }

        log.debug("Discover {} members through {} within {}", expectedCount, entryPoint.getGossipAddress(), window);

        int dropped = 0;
        try (GossipSession session = source.open(entryPoint)) {
            while (members.size() < expectedCount) {
                Duration remaining = window.minus(stopwatch.elapsed());
                if (remaining.isNegative() || remaining.isZero()) {
                    break;
                }

                Optional<List<ContactRecord>> records = poll(session, remaining);
                if (records.isPresent()) {
                    dropped += collect(records.get(), members, expectedCount);
                }

                if (members.size() >= expectedCount) {
                    break;
                }
                pause(window.minus(stopwatch.elapsed()));
            }
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.debug("Gossip session with {} failed", entryPoint.getGossipAddress(), e);
        }

        boolean windowExpired = members.size() < expectedCount;
        DiscoveredSet result = new DiscoveredSet(
                ImmutableList.copyOf(members.values()), expectedCount, windowExpired, stopwatch.elapsed()
        );

        log.info("Discovered {}/{} members in {}, dropped {} invalid records",
                result.size(), expectedCount, stopwatch, dropped);
        return result;
    }

    /**
     * Adds the valid members among the records until the expected count is reached.
     *
     * @return number of dropped records
     */
    private int collect(List<ContactRecord> records, Map<String, ContactInfo> members, int expectedCount) {
        int dropped = 0;
        for (ContactRecord record : records) {
            if (members.size() >= expectedCount) {
                break;
            }

            Optional<ContactInfo> contact = ContactInfo.fromRecord(record);
            if (!contact.isPresent() || isSelf(contact.get())) {
                dropped++;
                continue;
            }

            members.putIfAbsent(contact.get().getId(), contact.get());
        }
        return dropped;
    }

    private boolean isSelf(ContactInfo contact) {
        boolean sameId = params.getSelfId()
                .map(self -> self.equals(contact.getId()))
                .orElse(false);
        boolean sameAddress = params.getSelfGossipAddress()
                .map(self -> self.equals(contact.getGossipAddress()))
                .orElse(false);
        return sameId || sameAddress;
    }

    private Optional<List<ContactRecord>> poll(GossipSession session, Duration remaining) {
        Future<List<ContactRecord>> records = POLLERS.submit(session::poll);
        try {
            return Optional.ofNullable(records.get(remaining.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            records.cancel(true);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.debug("Gossip poll failed: {}", e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            records.cancel(true);
            throw new IllegalStateException("Interrupted while discovering", e);
        }
    }

    private void pause(Duration remaining) {
        Duration pause = params.getPollInterval().compareTo(remaining) < 0 ? params.getPollInterval() : remaining;
        if (pause.isNegative() || pause.isZero()) {
            return;
        }

        try {
            TimeUnit.NANOSECONDS.sleep(pause.toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while discovering", e);
        }
    }
}
