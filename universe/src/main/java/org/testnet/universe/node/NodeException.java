package org.testnet.universe.node;

import lombok.Getter;
import org.testnet.universe.universe.UniverseException;

/**
 * This class represents a failed lifecycle operation on a single {@link NodeRecord},
 * for instance a launch that never confirmed its process group.
 */
public class NodeException extends UniverseException {

    @Getter
    private final String host;

    public NodeException(String host, String message) {
        super(message + ". Node: " + host);
        this.host = host;
    }

    public NodeException(String host, String message, Throwable cause) {
        super(message + ". Node: " + host, cause);
        this.host = host;
    }
}
