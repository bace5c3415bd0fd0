package org.testnet.universe.discovery;

import lombok.AllArgsConstructor;
import lombok.NonNull;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.rpc.ControlPlaneClient;
import org.testnet.universe.rpc.JsonRpcTransport;

/**
 * Reads membership from the entry point's gossip table over its control plane.
 */
@AllArgsConstructor
public class RpcGossipSource implements GossipSource {

    @NonNull
    private final JsonRpcTransport transport;

    @Override
    public GossipSession open(ContactInfo entryPoint) {
        ControlPlaneClient client = ControlPlaneClient.forNode(entryPoint, transport);
        return client::getClusterNodes;
    }
}
