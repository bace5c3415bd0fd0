package org.testnet.universe.scenario;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one scenario run.
 */
@AllArgsConstructor
@ToString
public class ScenarioResult {

    @Getter
    @NonNull
    private final String cluster;

    @Getter
    @NonNull
    private final String scenario;

    @Getter
    @NonNull
    private final Duration elapsed;

    private final Throwable failure;

    public static ScenarioResult passed(String cluster, String scenario, Duration elapsed) {
        return new ScenarioResult(cluster, scenario, elapsed, null);
    }

    public static ScenarioResult failed(String cluster, String scenario, Duration elapsed, Throwable failure) {
        return new ScenarioResult(cluster, scenario, elapsed, failure);
    }

    public boolean isPassed() {
        return failure == null;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }
}
