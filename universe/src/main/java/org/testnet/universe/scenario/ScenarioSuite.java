package org.testnet.universe.scenario;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs scenarios on several disjoint clusters in parallel, sequentially within each cluster.
 */
@Slf4j
public class ScenarioSuite {

    private static final ExecutorService CLUSTERS = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                    .setDaemon(true)
                    .setNameFormat("scenario-suite-%d")
                    .build()
    );

    private final Map<ScenarioRunner, Map<String, ClusterScenario>> plan = new LinkedHashMap<>();

    /**
     * Adds a cluster and the scenarios to run on it.
     *
     * @throws IllegalArgumentException if the cluster is already part of the suite
     */
    public ScenarioSuite add(ScenarioRunner runner, Map<String, ClusterScenario> scenarios) {
        boolean shared = plan.keySet().stream().anyMatch(existing ->
                existing.getCluster().equals(runner.getCluster())
                        || existing.getEntryPoint().equals(runner.getEntryPoint()));
        if (shared) {
            throw new IllegalArgumentException("Cluster is already part of the suite: " + runner.getCluster());
        }

        plan.put(runner, ImmutableMap.copyOf(scenarios));
        return this;
    }

    /**
     * Runs every cluster's scenarios and waits for all of them.
     *
     * @return results per cluster name
     */
    public ImmutableMap<String, ImmutableList<ScenarioResult>> run() {
        Map<String, CompletableFuture<ImmutableList<ScenarioResult>>> runs = new LinkedHashMap<>();
        plan.forEach((runner, scenarios) -> runs.put(
                runner.getCluster(),
                CompletableFuture.supplyAsync(() -> runner.runAll(scenarios), CLUSTERS)
        ));

        ImmutableMap.Builder<String, ImmutableList<ScenarioResult>> results = ImmutableMap.builder();
        runs.forEach((cluster, run) -> results.put(cluster, run.join()));

        ImmutableMap<String, ImmutableList<ScenarioResult>> all = results.build();
        long failed = all.values().stream()
                .flatMap(ImmutableList::stream)
                .filter(result -> !result.isPassed())
                .count();
        log.info("Scenario suite finished: {} clusters, {} failed scenarios", all.size(), failed);
        return all;
    }
}
