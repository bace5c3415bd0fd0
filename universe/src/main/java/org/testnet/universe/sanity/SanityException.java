package org.testnet.universe.sanity;

import lombok.Getter;
import org.testnet.universe.universe.UniverseException;

/**
 * The cluster failed its post-boot sanity battery. Nodes are left running for inspection.
 */
public class SanityException extends UniverseException {

    @Getter
    private final SanityResult result;

    public SanityException(SanityResult result) {
        super("Sanity check failed on " + result.getHost() + ": " + result.getFailures());
        this.result = result;
    }
}
