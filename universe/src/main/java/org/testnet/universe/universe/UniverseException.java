package org.testnet.universe.universe;

/**
 * Common exception of the testnet universe, wrapping the problems that prevented a successful
 * deployment, check or control-plane operation on a cluster.
 * <p>
 * Every infrastructure failure (artifacts, deployment, sanity, rpc) extends this class so that
 * callers such as the command line can map the whole family to a single failure exit code.
 */
public class UniverseException extends RuntimeException {
    public UniverseException(String message) {
        super(message);
    }

    public UniverseException(String message, Throwable cause) {
        super(message, cause);
    }
}
