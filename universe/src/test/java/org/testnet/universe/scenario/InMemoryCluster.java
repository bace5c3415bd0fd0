package org.testnet.universe.scenario;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import lombok.Getter;
import lombok.Setter;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;
import org.testnet.universe.rpc.JsonRpcTransport;
import org.testnet.universe.rpc.RpcException;
import org.testnet.universe.rpc.RpcException.Kind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A cluster of simulated nodes answering the control plane in memory. Every node's gossip
 * table holds all cluster members plus whatever was pushed into it.
 */
public class InMemoryCluster implements JsonRpcTransport {

    private final Map<String, SimulatedNode> nodes = new LinkedHashMap<>();

    private final boolean gossipPushEnabled;
    private final boolean refreshActiveSetEnabled;

    /**
     * Makes every node stop confirming transactions once its active set was refreshed while
     * its gossip table held malformed entries.
     */
    @Setter
    private volatile boolean fragileUnderFlood;

    public InMemoryCluster(int size, boolean gossipPushEnabled, boolean refreshActiveSetEnabled) {
        this("10.0.0", size, gossipPushEnabled, refreshActiveSetEnabled);
    }

    /**
     * @param subnet first three octets of the node addresses
     */
    public InMemoryCluster(String subnet, int size, boolean gossipPushEnabled, boolean refreshActiveSetEnabled) {
        this.gossipPushEnabled = gossipPushEnabled;
        this.refreshActiveSetEnabled = refreshActiveSetEnabled;
        for (int i = 1; i <= size; i++) {
            SimulatedNode node = new SimulatedNode(subnet + "-node-" + i, subnet + "." + i);
            nodes.put(node.rpc, node);
        }
    }

    public ContactInfo entryPoint() {
        SimulatedNode first = nodes.values().iterator().next();
        return ContactInfo.builder()
                .id(first.id)
                .gossipAddress(first.gossip)
                .rpcAddress(first.rpc)
                .build();
    }

    public SimulatedNode node(int index) {
        return new ArrayList<>(nodes.values()).get(index);
    }

    public int pushedEntries() {
        return nodes.values().stream().mapToInt(node -> node.pushed.size()).sum();
    }

    @Override
    public JsonObject send(String endpoint, JsonObject request) {
        SimulatedNode node = nodes.get(endpoint);
        if (node == null) {
            throw new RpcException(Kind.REFUSED, endpoint, "connection refused");
        }

        String method = request.get("method").getAsString();
        JsonArray params = request.get("params").getAsJsonArray();
        JsonObject response = new JsonObject();
        response.addProperty("jsonrpc", "2.0");
        response.add("id", request.get("id"));

        try {
            response.add("result", node.handle(method, params));
        } catch (UnsupportedOperationException e) {
            JsonObject error = new JsonObject();
            error.addProperty("code", -32601);
            error.addProperty("message", e.getMessage());
            response.add("error", error);
        }
        return response;
    }

    private JsonArray clusterNodes(SimulatedNode self) {
        JsonArray table = new JsonArray();
        for (SimulatedNode member : nodes.values()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("pubkey", member.id);
            entry.addProperty("gossip", member.gossip);
            entry.addProperty("rpc", member.rpc);
            table.add(entry);
        }
        self.pushed.forEach(table::add);
        return table;
    }

    /**
     * One node of the cluster.
     */
    public class SimulatedNode {
        @Getter
        private final String id;
        private final String gossip;
        private final String rpc;

        private final List<JsonObject> pushed = new CopyOnWriteArrayList<>();
        private final Set<String> transactions = ConcurrentHashMap.newKeySet();
        private final AtomicInteger blockhashes = new AtomicInteger();

        @Getter
        private final AtomicInteger refreshes = new AtomicInteger();

        private volatile boolean stalled;

        SimulatedNode(String id, String host) {
            this.id = id;
            this.gossip = host + ":8001";
            this.rpc = host + ":8899";
        }

        public int getTransactionCount() {
            return transactions.size();
        }

        public int getPushedCount() {
            return pushed.size();
        }

        JsonElement handle(String method, JsonArray params) {
            switch (method) {
                case "getClusterNodes":
                    return clusterNodes(this);
                case "pushGossipEntry":
                    if (!gossipPushEnabled) {
                        throw new UnsupportedOperationException("Method not found");
                    }
                    pushed.add(params.get(0).getAsJsonObject());
                    return JsonNull.INSTANCE;
                case "refreshActiveSet":
                    if (!refreshActiveSetEnabled) {
                        throw new UnsupportedOperationException("Method not found");
                    }
                    refreshes.incrementAndGet();
                    if (fragileUnderFlood && hasMalformedEntries()) {
                        stalled = true;
                    }
                    return JsonNull.INSTANCE;
                case "getHealth":
                    return new JsonPrimitive(stalled ? "behind" : "ok");
                case "getRecentBlockhash":
                    JsonObject value = new JsonObject();
                    value.addProperty("blockhash", "hash-" + blockhashes.incrementAndGet());
                    JsonObject result = new JsonObject();
                    result.add("value", value);
                    return result;
                case "sendTransaction":
                    String signature = "sig-" + params.get(0).getAsString();
                    if (!stalled) {
                        transactions.add(signature);
                    }
                    return new JsonPrimitive(signature);
                case "confirmTransaction":
                    return new JsonPrimitive(transactions.contains(params.get(0).getAsString()));
                case "getTransactionCount":
                    return new JsonPrimitive(transactions.size());
                default:
                    throw new UnsupportedOperationException("Method not found: " + method);
            }
        }

        private boolean hasMalformedEntries() {
            return pushed.stream()
                    .map(entry -> new ContactRecord(text(entry, "id"), text(entry, "gossip"), text(entry, "rpc")))
                    .anyMatch(record -> !ContactInfo.fromRecord(record).isPresent());
        }

        private String text(JsonObject entry, String field) {
            return Optional.ofNullable(entry.get(field))
                    .filter(JsonElement::isJsonPrimitive)
                    .map(JsonElement::getAsString)
                    .orElse(null);
        }
    }
}
