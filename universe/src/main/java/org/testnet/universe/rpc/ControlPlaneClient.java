package org.testnet.universe.rpc;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;
import org.testnet.universe.rpc.RpcException.Kind;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Synchronous JSON-RPC 2.0 client of a single node's control plane.
 * <p>
 * Every call blocks its caller, either returns the decoded result or throws an
 * {@link RpcException}, and is attempted exactly once. Calls to different nodes are
 * independent, so a caller may drive many clients concurrently.
 */
@Slf4j
public class ControlPlaneClient {

    static final String JSON_RPC_VERSION = "2.0";

    private static final AtomicLong REQUEST_IDS = new AtomicLong();

    @Getter
    private final String endpoint;

    private final JsonRpcTransport transport;

    public ControlPlaneClient(@NonNull String endpoint, @NonNull JsonRpcTransport transport) {
        this.endpoint = endpoint;
        this.transport = transport;
    }

    public static ControlPlaneClient forNode(ContactInfo node, JsonRpcTransport transport) {
        return new ControlPlaneClient(node.getRpcAddress(), transport);
    }

    /**
     * Injects a contact record, valid or not, into the node's gossip table. Needs
     * the node to be booted with gossip push enabled.
     */
    public void pushGossipEntry(@NonNull ContactRecord record) {
        JsonObject entry = new JsonObject();
        addNullable(entry, "id", record.getId());
        addNullable(entry, "gossip", record.getGossip());
        addNullable(entry, "rpc", record.getRpc());
        record.getServices().forEach((name, address) -> addNullable(entry, name, address));

        JsonArray params = new JsonArray();
        params.add(entry);
        call("pushGossipEntry", params);
    }

    /**
     * Makes the node re-select its active gossip peers now. Needs the node to be booted with
     * active set refresh enabled.
     */
    public void refreshActiveSet() {
        call("refreshActiveSet", new JsonArray());
    }

    public HealthStatus getHealth() {
        return decode("getHealth", call("getHealth", new JsonArray()),
                result -> HealthStatus.parse(result.getAsString()));
    }

    /**
     * The contact records the node currently knows, undecoded: discovery decides which of them
     * are usable.
     */
    public ImmutableList<ContactRecord> getClusterNodes() {
        return decode("getClusterNodes", call("getClusterNodes", new JsonArray()), result -> {
            ImmutableList.Builder<ContactRecord> records = ImmutableList.builder();
            for (JsonElement element : result.getAsJsonArray()) {
                // a non-object entry becomes an empty record, which discovery drops on its own
                records.add(element.isJsonObject()
                        ? toContactRecord(element.getAsJsonObject())
                        : new ContactRecord(null, null, null));
            }
            return records.build();
        });
    }

    public long getBalance(@NonNull String publicKey) {
        JsonArray params = new JsonArray();
        params.add(publicKey);
        return decode("getBalance", call("getBalance", params), result -> unwrapValue(result).getAsLong());
    }

    public String getRecentBlockhash() {
        return decode("getRecentBlockhash", call("getRecentBlockhash", new JsonArray()), result -> {
            JsonElement value = unwrapValue(result);
            if (value.isJsonArray()) {
                return value.getAsJsonArray().get(0).getAsString();
            }
            if (value.isJsonObject()) {
                return value.getAsJsonObject().get("blockhash").getAsString();
            }
            return value.getAsString();
        });
    }

    /**
     * Submits a signed, encoded transaction.
     *
     * @return the transaction signature
     */
    public String sendTransaction(@NonNull String encodedTransaction) {
        JsonArray params = new JsonArray();
        params.add(encodedTransaction);
        return decode("sendTransaction", call("sendTransaction", params), JsonElement::getAsString);
    }

    public boolean confirmTransaction(@NonNull String signature) {
        JsonArray params = new JsonArray();
        params.add(signature);
        return decode("confirmTransaction", call("confirmTransaction", params),
                result -> unwrapValue(result).getAsBoolean());
    }

    public long getTransactionCount() {
        return decode("getTransactionCount", call("getTransactionCount", new JsonArray()), JsonElement::getAsLong);
    }

    /**
     * Asks the node to exit. Needs the node to be booted with fullnode exit enabled.
     *
     * @return true if the node accepted the request
     */
    public boolean fullnodeExit() {
        return decode("fullnodeExit", call("fullnodeExit", new JsonArray()), JsonElement::getAsBoolean);
    }

    private JsonElement call(String method, JsonArray params) {
        JsonObject request = new JsonObject();
        request.addProperty("jsonrpc", JSON_RPC_VERSION);
        request.addProperty("id", REQUEST_IDS.incrementAndGet());
        request.addProperty("method", method);
        request.add("params", params);

        log.trace("{} {}", endpoint, method);
        JsonObject response = transport.send(endpoint, request);

        JsonElement error = response.get("error");
        if (error != null && !error.isJsonNull()) {
            throw new RpcException(Kind.REMOTE, endpoint, method + " failed: " + error);
        }

        if (!response.has("result")) {
            throw new RpcException(Kind.DECODE, endpoint, method + " response has no result: " + response);
        }
        return response.get("result");
    }

    private <T> T decode(String method, JsonElement result, Function<JsonElement, T> decoder) {
        try {
            return decoder.apply(result);
        } catch (RuntimeException e) {
            throw new RpcException(Kind.DECODE, endpoint, method + " returned an unexpected result: " + result, e);
        }
    }

    /**
     * Results may come wrapped in a context object: {"context": {...}, "value": ...}.
     */
    private static JsonElement unwrapValue(JsonElement result) {
        if (result.isJsonObject() && result.getAsJsonObject().has("value")) {
            return result.getAsJsonObject().get("value");
        }
        return result;
    }

    private static ContactRecord toContactRecord(JsonObject node) {
        ImmutableMap.Builder<String, String> services = ImmutableMap.builder();
        String id = null;
        String gossip = null;
        String rpc = null;

        for (Map.Entry<String, JsonElement> field : node.entrySet()) {
            JsonElement value = field.getValue();
            if (!value.isJsonPrimitive()) {
                continue;
            }
            String text = value.getAsString();
            switch (field.getKey()) {
                case "id":
                case "pubkey":
                    id = text;
                    break;
                case "gossip":
                    gossip = text;
                    break;
                case "rpc":
                    rpc = text;
                    break;
                default:
                    services.put(field.getKey(), text);
            }
        }

        return new ContactRecord(id, gossip, rpc, services.build());
    }

    private static void addNullable(JsonObject object, String name, String value) {
        object.add(name, value == null ? null : new JsonPrimitive(value));
    }
}
