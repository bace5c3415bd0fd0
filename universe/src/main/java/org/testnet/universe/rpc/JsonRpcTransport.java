package org.testnet.universe.rpc;

import com.google.gson.JsonObject;

/**
 * Delivers one JSON-RPC 2.0 request to a node and returns the raw response object.
 */
@FunctionalInterface
public interface JsonRpcTransport {

    /**
     * @param endpoint the node's client-facing rpc address, host:port
     * @param request  complete JSON-RPC request
     * @return the response object, which may hold a result or an error
     * @throws RpcException of kind TIMEOUT, REFUSED or DECODE if no response object is received
     */
    JsonObject send(String endpoint, JsonObject request);
}
