package org.testnet.universe.util;

import org.testnet.universe.universe.UniverseException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocks the calling thread for a while.
 */
@FunctionalInterface
public interface Pauser {

    Pauser SLEEP = duration -> {
        try {
            TimeUnit.MILLISECONDS.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UniverseException("Interrupted", e);
        }
    };

    void pause(Duration duration);
}
