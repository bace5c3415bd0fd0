package org.testnet.universe.remote;

import org.testnet.universe.universe.UniverseException;

/**
 * A command could not be executed locally or on a remote host, or it failed.
 */
public class RemoteException extends UniverseException {

    public RemoteException(String message) {
        super(message);
    }

    public RemoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
