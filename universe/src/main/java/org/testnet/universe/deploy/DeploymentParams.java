package org.testnet.universe.deploy;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.testnet.universe.artifact.ArtifactSource;
import org.testnet.universe.remote.StateMode;
import org.testnet.universe.sanity.SanityOptions;
import org.testnet.universe.topology.ClusterTopology;
import org.testnet.universe.topology.FullnodeConfig;

import java.time.Duration;

/**
 * Everything one deployment run needs to know.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class DeploymentParams {

    @NonNull
    private final ClusterTopology topology;

    @Default
    @NonNull
    private final FullnodeConfig fullnodeConfig = FullnodeConfig.DEFAULT;

    @Default
    @NonNull
    private final ArtifactSource artifactSource = ArtifactSource.local();

    /**
     * Whether prior node state is deleted or its configuration reused.
     */
    @Default
    @NonNull
    private final StateMode stateMode = StateMode.RESET;

    @Default
    @NonNull
    private final SanityOptions sanityOptions = SanityOptions.DEFAULT;

    /**
     * Launches issued before the orchestrator pauses.
     */
    @Default
    private final int burstSize = LaunchLimiter.DEFAULT_BURST_SIZE;

    @Default
    @NonNull
    private final Duration burstPause = LaunchLimiter.DEFAULT_BURST_PAUSE;

    /**
     * Follower launches allowed to run at the same time.
     */
    @Default
    private final int maxInFlight = LaunchLimiter.UNBOUNDED;
}
