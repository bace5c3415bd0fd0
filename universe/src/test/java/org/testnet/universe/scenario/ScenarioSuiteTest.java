package org.testnet.universe.scenario;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioSuiteTest {

    @Test
    public void clustersRunInParallel() {
        CountDownLatch bothRunning = new CountDownLatch(2);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        ClusterScenario rendezvous = (harness, entryPoint, funder, nodeCount) -> {
            threads.add(Thread.currentThread().getName());
            bothRunning.countDown();
            try {
                if (!bothRunning.await(10, TimeUnit.SECONDS)) {
                    throw new ScenarioException("clusters did not run in parallel");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScenarioException("interrupted", e);
            }
        };

        ImmutableMap<String, ImmutableList<ScenarioResult>> results = new ScenarioSuite()
                .add(ScenarioRunnerTest.runner("alpha", new InMemoryCluster(1, false, false)),
                        ImmutableMap.of("rendezvous", rendezvous))
                .add(ScenarioRunnerTest.runner("beta", otherCluster()),
                        ImmutableMap.of("rendezvous", rendezvous))
                .run();

        assertThat(results).containsOnlyKeys("alpha", "beta");
        assertThat(results.values()).allSatisfy(batch ->
                assertThat(batch).extracting(ScenarioResult::isPassed).containsExactly(true));
        assertThat(threads).hasSize(2);
    }

    @Test
    public void clustersMustBeDisjoint() {
        InMemoryCluster cluster = new InMemoryCluster(1, false, false);
        ScenarioSuite suite = new ScenarioSuite()
                .add(ScenarioRunnerTest.runner("alpha", cluster), ImmutableMap.of());

        assertThatThrownBy(() -> suite.add(ScenarioRunnerTest.runner("alpha", otherCluster()), ImmutableMap.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> suite.add(ScenarioRunnerTest.runner("beta", cluster), ImmutableMap.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static InMemoryCluster otherCluster() {
        return new InMemoryCluster("10.0.1", 1, false, false);
    }
}
