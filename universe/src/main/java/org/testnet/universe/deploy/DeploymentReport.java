package org.testnet.universe.deploy;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.testnet.universe.sanity.SanityResult;
import org.testnet.universe.topology.ClusterTopology;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Summary of a successful deployment run.
 */
@Builder
@Getter
@ToString
public class DeploymentReport {

    @NonNull
    private final String networkVersion;

    @NonNull
    private final Duration leaderDeployTime;

    @NonNull
    private final Duration followerDeployTime;

    /**
     * Time taken to issue the client launches, which are not awaited.
     */
    @NonNull
    private final Duration clientDeployTime;

    @NonNull
    private final ClusterTopology topology;

    @NonNull
    private final SanityResult sanity;

    @NonNull
    private final Path logDirectory;

    /**
     * Completes when every client launch has finished, successfully or not. Never completes
     * exceptionally.
     */
    @NonNull
    @ToString.Exclude
    private final CompletableFuture<Void> clientLaunches;
}
