package org.testnet.universe.discovery;

import org.testnet.universe.node.ContactRecord;

import java.util.List;

/**
 * An open connection to the gossip network.
 */
public interface GossipSession extends AutoCloseable {

    /**
     * The advertisements received since the session was opened, or the current membership
     * table of the entry point. Records are raw and may be malformed.
     */
    List<ContactRecord> poll();

    @Override
    default void close() {
        // nothing to release by default
    }
}
