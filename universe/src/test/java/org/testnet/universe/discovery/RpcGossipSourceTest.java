package org.testnet.universe.discovery;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;
import org.testnet.universe.node.ContactInfo;
import org.testnet.universe.node.ContactRecord;
import org.testnet.universe.topology.ServicePorts;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RpcGossipSourceTest {

    @Test
    public void pollsClusterNodesOfEntryPoint() {
        ContactInfo entryPoint = ContactInfo.forHost("10.0.0.1", ServicePorts.DEFAULT);

        RpcGossipSource source = new RpcGossipSource((endpoint, request) -> {
            assertThat(endpoint).isEqualTo("10.0.0.1:8899");
            assertThat(request.get("method").getAsString()).isEqualTo("getClusterNodes");

            JsonObject node = new JsonObject();
            node.addProperty("pubkey", "node-1");
            node.addProperty("gossip", "10.0.0.1:8001");
            node.addProperty("rpc", "10.0.0.1:8899");
            node.addProperty("tpu", "10.0.0.1:8003");
            JsonArray nodes = new JsonArray();
            nodes.add(node);

            JsonObject response = new JsonObject();
            response.add("result", nodes);
            return response;
        });

        List<ContactRecord> records;
        try (GossipSession session = source.open(entryPoint)) {
            records = session.poll();
        }

        assertThat(records).containsExactly(new ContactRecord(
                "node-1", "10.0.0.1:8001", "10.0.0.1:8899",
                ImmutableMap.of("tpu", "10.0.0.1:8003")
        ));
    }

    @Test
    public void nonObjectEntriesDoNotHideValidMembers() {
        ContactInfo entryPoint = ContactInfo.forHost("10.0.0.1", ServicePorts.DEFAULT);

        RpcGossipSource source = new RpcGossipSource((endpoint, request) -> {
            JsonArray nodes = new JsonArray();
            nodes.add(node("node-a", "10.0.0.2"));
            nodes.add(node("node-b", "10.0.0.3"));
            nodes.add("garbage");
            nodes.add(42);
            nodes.add(JsonNull.INSTANCE);

            JsonObject response = new JsonObject();
            response.add("result", nodes);
            return response;
        });
        DiscoveryParams params = DiscoveryParams.builder()
                .window(Duration.ofMillis(500))
                .pollInterval(Duration.ofMillis(10))
                .build();

        DiscoveredSet discovered = new GossipDiscovery(source, params).discover(entryPoint, 2);

        assertThat(discovered.isWindowExpired()).isFalse();
        assertThat(discovered.getMembers()).extracting(ContactInfo::getId).containsExactly("node-a", "node-b");
    }

    private static JsonObject node(String id, String host) {
        JsonObject node = new JsonObject();
        node.addProperty("id", id);
        node.addProperty("gossip", host + ":8001");
        node.addProperty("rpc", host + ":8899");
        return node;
    }
}
