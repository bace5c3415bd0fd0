package org.testnet.universe.rpc;

import lombok.Getter;
import org.testnet.universe.universe.UniverseException;

/**
 * A single control-plane call failed. Calls are never retried; the {@link Kind} tells the
 * caller what happened so it can decide on its own retry policy.
 */
public class RpcException extends UniverseException {

    @Getter
    private final Kind kind;

    @Getter
    private final String endpoint;

    public RpcException(Kind kind, String endpoint, String message) {
        super(kind + " " + endpoint + ": " + message);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public RpcException(Kind kind, String endpoint, String message, Throwable cause) {
        super(kind + " " + endpoint + ": " + message, cause);
        this.kind = kind;
        this.endpoint = endpoint;
    }

    public enum Kind {
        /**
         * No response within the call timeout.
         */
        TIMEOUT,
        /**
         * The node could not be reached or refused the connection.
         */
        REFUSED,
        /**
         * The response is not a valid JSON-RPC response of the expected shape.
         */
        DECODE,
        /**
         * The node answered with a JSON-RPC error, e.g. because the method is not enabled.
         */
        REMOTE
    }
}
