package org.testnet.universe.scenario;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.node.ContactInfo;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs scenarios against one cluster, one at a time.
 * <p>
 * Scenarios mutate shared cluster state (gossip tables, active sets), so a runner refuses to
 * start a scenario while another one is running on it. A failing scenario is recorded and
 * does not prevent the next one from running.
 */
@Slf4j
@Builder
public class ScenarioRunner {

    /**
     * Name of the cluster the runner drives.
     */
    @Getter
    @NonNull
    private final String cluster;

    @NonNull
    private final ScenarioHarness harness;

    @Getter
    @NonNull
    private final ContactInfo entryPoint;

    @NonNull
    private final FundedCredential funder;

    private final int nodeCount;

    private final AtomicBoolean running = new AtomicBoolean();

    private final List<ScenarioResult> results = new CopyOnWriteArrayList<>();

    /**
     * Runs a scenario and records its result.
     *
     * @throws IllegalStateException if another scenario is running on this cluster
     */
    public ScenarioResult run(@NonNull String name, @NonNull ClusterScenario scenario) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A scenario is already running on cluster " + cluster);
        }

        log.info("Scenario {} on {}: started", name, cluster);
        Stopwatch stopwatch = Stopwatch.createStarted();
        ScenarioResult result;
        try {
            scenario.run(harness, entryPoint, funder, nodeCount);
            result = ScenarioResult.passed(cluster, name, stopwatch.elapsed());
            log.info("Scenario {} on {}: passed in {}", name, cluster, stopwatch);
        } catch (RuntimeException | AssertionError e) {
            result = ScenarioResult.failed(cluster, name, stopwatch.elapsed(), e);
            log.error("Scenario {} on {}: failed in {}", name, cluster, stopwatch, e);
        } finally {
            running.set(false);
        }

        results.add(result);
        return result;
    }

    /**
     * Runs the scenarios in iteration order.
     */
    public ImmutableList<ScenarioResult> runAll(Map<String, ClusterScenario> scenarios) {
        ImmutableList.Builder<ScenarioResult> batch = ImmutableList.builder();
        scenarios.forEach((name, scenario) -> batch.add(run(name, scenario)));
        return batch.build();
    }

    public ImmutableList<ScenarioResult> getResults() {
        return ImmutableList.copyOf(results);
    }
}
