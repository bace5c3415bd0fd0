package org.testnet.universe.scenario;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;
import org.testnet.universe.discovery.GossipDiscovery;
import org.testnet.universe.discovery.RpcGossipSource;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioRunnerTest {

    @Test
    public void rejectsConcurrentScenarios() throws Exception {
        ScenarioRunner runner = runner("alpha", new InMemoryCluster(1, false, false));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<ScenarioResult> first = CompletableFuture.supplyAsync(() -> runner.run("blocking",
                (harness, entryPoint, funder, nodeCount) -> {
                    started.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }));

        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        assertThatThrownBy(() -> runner.run("second", (harness, entryPoint, funder, nodeCount) -> { }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("alpha");

        release.countDown();
        assertThat(first.get(10, TimeUnit.SECONDS).isPassed()).isTrue();
        assertThat(runner.run("third", (harness, entryPoint, funder, nodeCount) -> { }).isPassed()).isTrue();
    }

    @Test
    public void failuresAreRecordedAndNextScenarioRuns() {
        ScenarioRunner runner = runner("alpha", new InMemoryCluster(1, false, false));
        Map<String, ClusterScenario> scenarios = ImmutableMap.of(
                "throws", (harness, entryPoint, funder, nodeCount) -> {
                    throw new ScenarioException("invariant broken");
                },
                "asserts", (harness, entryPoint, funder, nodeCount) -> assertThat(nodeCount).isZero(),
                "passes", (harness, entryPoint, funder, nodeCount) -> { }
        );

        runner.runAll(scenarios);

        assertThat(runner.getResults()).extracting(ScenarioResult::getScenario)
                .containsExactly("throws", "asserts", "passes");
        assertThat(runner.getResults()).extracting(ScenarioResult::isPassed)
                .containsExactly(false, false, true);
        assertThat(runner.getResults().get(1).getFailure()).containsInstanceOf(AssertionError.class);
        assertThat(runner.getResults()).extracting(ScenarioResult::getCluster).containsOnly("alpha");
    }

    @Test
    public void scenarioReceivesItsInputs() {
        InMemoryCluster cluster = new InMemoryCluster(2, false, false);
        ScenarioRunner runner = runner("alpha", cluster);

        ScenarioResult result = runner.run("inputs", (harness, entryPoint, funder, nodeCount) -> {
            assertThat(entryPoint).isEqualTo(cluster.entryPoint());
            assertThat(funder.getPublicKey()).isEqualTo("funder");
            assertThat(nodeCount).isEqualTo(1);
            assertThat(harness.controlPlane(entryPoint).getEndpoint()).isEqualTo("10.0.0.1:8899");
        });

        assertThat(result.isPassed()).isTrue();
    }

    static ScenarioRunner runner(String name, InMemoryCluster cluster) {
        ScenarioHarness harness = ScenarioHarness.builder()
                .transport(cluster)
                .discovery(new GossipDiscovery(new RpcGossipSource(cluster)))
                .build();
        return ScenarioRunner.builder()
                .cluster(name)
                .harness(harness)
                .entryPoint(cluster.entryPoint())
                .funder(CountingSigner.funder())
                .nodeCount(1)
                .build();
    }
}
