package org.testnet.universe.scenario;

import org.testnet.universe.universe.UniverseException;

/**
 * An invariant checked by a scenario does not hold.
 */
public class ScenarioException extends UniverseException {

    public ScenarioException(String message) {
        super(message);
    }

    public ScenarioException(String message, Throwable cause) {
        super(message, cause);
    }
}
