package org.testnet.universe.discovery;

import org.testnet.universe.node.ContactInfo;

/**
 * Where membership advertisements come from. Implementations join (or query) the gossip
 * network through exactly one entry point.
 */
@FunctionalInterface
public interface GossipSource {

    GossipSession open(ContactInfo entryPoint);
}
