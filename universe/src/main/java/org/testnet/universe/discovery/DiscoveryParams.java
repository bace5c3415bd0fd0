package org.testnet.universe.discovery;

import com.google.common.base.Ticker;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

/**
 * Timing of a discovery and the identity of the discovering party.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class DiscoveryParams {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(3);

    public static final DiscoveryParams DEFAULT = DiscoveryParams.builder().build();

    /**
     * How long a discovery collects advertisements. Discovery never blocks longer.
     */
    @Default
    @NonNull
    private final Duration window = DEFAULT_WINDOW;

    /**
     * Pause between two polls of the gossip session.
     */
    @Default
    @NonNull
    private final Duration pollInterval = Duration.ofMillis(100);

    /**
     * Node id of the discovering party; records carrying it are dropped.
     */
    private final String selfId;

    /**
     * Gossip address of the discovering party; records pointing to it are dropped.
     */
    private final String selfGossipAddress;

    @Default
    @NonNull
    @ToString.Exclude
    private final Ticker ticker = Ticker.systemTicker();

    public Optional<String> getSelfId() {
        return Optional.ofNullable(selfId);
    }

    public Optional<String> getSelfGossipAddress() {
        return Optional.ofNullable(selfGossipAddress);
    }
}
