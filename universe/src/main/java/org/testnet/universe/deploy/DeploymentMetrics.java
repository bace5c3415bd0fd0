package org.testnet.universe.deploy;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Milestones of deployment runs, counted in a {@link MeterRegistry}.
 */
@Slf4j
public class DeploymentMetrics {

    static final String MILESTONE_METER = "testnet.deploy.milestone";
    static final String VERSION_METER = "testnet.deploy.version";
    static final String MILESTONE_TAG = "milestone";
    static final String VERSION_TAG = "version";

    private static final int VERSION_LENGTH = 9;

    @Getter
    private final MeterRegistry registry;

    public DeploymentMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics kept in memory only.
     */
    public static DeploymentMetrics inMemory() {
        return new DeploymentMetrics(new SimpleMeterRegistry());
    }

    public void milestone(Milestone milestone) {
        log.info("testnet-deploy {}", milestone.getName());
        registry.counter(MILESTONE_METER, MILESTONE_TAG, milestone.getName()).increment();
    }

    /**
     * Records the network version a run deployed, cut to its first nine characters.
     */
    public void version(@NonNull String version) {
        String shortVersion = shortVersion(version);
        log.info("testnet-deploy version=\"{}\"", shortVersion);
        registry.counter(VERSION_METER, VERSION_TAG, shortVersion).increment();
    }

    /**
     * How often a milestone has been reached.
     */
    public double count(Milestone milestone) {
        return registry.counter(MILESTONE_METER, MILESTONE_TAG, milestone.getName()).count();
    }

    static String shortVersion(String version) {
        return version.length() > VERSION_LENGTH ? version.substring(0, VERSION_LENGTH) : version;
    }

    @AllArgsConstructor
    public enum Milestone {
        START_BEGIN("net-start-begin"),
        UPDATE_BEGIN("net-update-begin"),
        LEADER_STARTED("net-bootnode-leader-started"),
        FULLNODES_STARTED("net-fullnodes-started"),
        SANITY_BEGIN("net-sanity-begin"),
        SANITY_COMPLETE("net-sanity-complete"),
        START_COMPLETE("net-start-complete"),
        UPDATE_COMPLETE("net-update-complete"),
        STOP_BEGIN("net-stop-begin"),
        STOP_COMPLETE("net-stop-complete");

        @Getter
        private final String name;
    }
}
