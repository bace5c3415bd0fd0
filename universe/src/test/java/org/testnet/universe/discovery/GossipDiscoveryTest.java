package org.testnet.universe.discovery;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;
import org.testnet.universe.topology.ServicePorts;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GossipDiscoveryTest {

    private static final ContactInfo ENTRY_POINT = ContactInfo.forHost("10.0.0.1", ServicePorts.DEFAULT);
    private static final Duration WINDOW = Duration.ofMillis(500);

    private final DiscoveryParams params = DiscoveryParams.builder()
            .window(WINDOW)
            .pollInterval(Duration.ofMillis(10))
            .build();

    @Test
    public void findsExpectedMembers() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> nodes(3), params);

        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.size()).isEqualTo(3);
        assertThat(discovered.isComplete()).isTrue();
        assertThat(discovered.isWindowExpired()).isFalse();
        assertThat(discovered.getMembers()).extracting(ContactInfo::getId).containsExactly("node-1", "node-2", "node-3");
    }

    @Test
    public void neverMoreThanExpected() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> nodes(10), params);

        assertThat(discovery.discover(ENTRY_POINT, 4).size()).isEqualTo(4);
    }

    @Test
    public void partialResultWhenWindowExpires() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> nodes(2), params);

        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.size()).isEqualTo(2);
        assertThat(discovered.isWindowExpired()).isTrue();
        assertThat(discovered.getElapsed()).isGreaterThanOrEqualTo(WINDOW);
    }

    @Test
    public void zeroExpectedReturnsImmediately() {
        AtomicBoolean opened = new AtomicBoolean();
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> {
            opened.set(true);
            return () -> nodes(3);
        }, params);

        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 0);

        assertThat(discovered.getMembers()).isEmpty();
        assertThat(discovered.isWindowExpired()).isFalse();
        assertThat(opened).isFalse();
    }

    @Test
    public void malformedAndSelfRecordsAreDropped() {
        DiscoveryParams self = params.toBuilder()
                .selfId("me")
                .selfGossipAddress("10.0.0.99:8001")
                .build();
        List<ContactRecord> records = ImmutableList.of(
                new ContactRecord("me", "10.0.0.50:8001", "10.0.0.50:8899"),
                new ContactRecord("other", "10.0.0.99:8001", "10.0.0.99:8899"),
                new ContactRecord("bad-1", "0.0.0.0:0", "0.0.0.0:0"),
                new ContactRecord("bad-2", "not an address", null),
                new ContactRecord(null, "10.0.0.7:8001", "10.0.0.7:8899"),
                new ContactRecord("node-1", "10.0.0.1:8001", "10.0.0.1:8899"),
                new ContactRecord("node-1", "10.0.0.1:8001", "10.0.0.1:8899")
        );
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> records, self);

        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.getMembers()).extracting(ContactInfo::getId).containsExactly("node-1");
        assertThat(discovered.isWindowExpired()).isTrue();
    }

    @Test
    public void floodDoesNotExtendWindow() {
        List<ContactRecord> flood = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            flood.add(new ContactRecord("malformed-" + i, "0.0.0.0:0", "garbage"));
        }
        flood.addAll(nodes(2));
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> flood, params);

        Stopwatch stopwatch = Stopwatch.createStarted();
        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.size()).isEqualTo(2);
        assertThat(stopwatch.elapsed()).isLessThan(WINDOW.plusSeconds(1));
    }

    @Test
    public void slowEntryPointDoesNotExtendWindow() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> {
            try {
                TimeUnit.SECONDS.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return nodes(3);
        }, params);

        Stopwatch stopwatch = Stopwatch.createStarted();
        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.size()).isZero();
        assertThat(discovered.isWindowExpired()).isTrue();
        assertThat(stopwatch.elapsed()).isLessThan(WINDOW.plusSeconds(1));
    }

    @Test
    public void failingPollsAreTolerated() {
        List<List<ContactRecord>> polls = new ArrayList<>();
        polls.add(null);
        polls.add(nodes(1));
        polls.add(nodes(3));
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> new GossipSession() {
            private int poll;

            @Override
            public List<ContactRecord> poll() {
                List<ContactRecord> records = polls.get(Math.min(poll++, polls.size() - 1));
                if (records == null) {
                    throw new IllegalStateException("connection reset");
                }
                return records;
            }
        }, params);

        assertThat(discovery.discover(ENTRY_POINT, 3).size()).isEqualTo(3);
    }

    @Test
    public void unreachableEntryPointGivesEmptyResult() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> {
            throw new IllegalStateException("connection refused");
        }, params);

        DiscoveredSet discovered = discovery.discover(ENTRY_POINT, 3);

        assertThat(discovered.getMembers()).isEmpty();
        assertThat(discovered.isWindowExpired()).isTrue();
    }

    @Test
    public void rejectsNegativeArguments() {
        GossipDiscovery discovery = new GossipDiscovery(entryPoint -> () -> nodes(1), params);

        assertThatThrownBy(() -> discovery.discover(ENTRY_POINT, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> discovery.discover(ENTRY_POINT, 1, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static List<ContactRecord> nodes(int count) {
        List<ContactRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(new ContactRecord("node-" + i, "10.0.0." + i + ":8001", "10.0.0." + i + ":8899"));
        }
        return records;
    }
}
