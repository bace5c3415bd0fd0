package org.testnet.universe.remote;

/**
 * Provides the {@link RemoteHost} of a node address.
 */
@FunctionalInterface
public interface RemoteHostFactory {

    RemoteHost forHost(String host);
}
