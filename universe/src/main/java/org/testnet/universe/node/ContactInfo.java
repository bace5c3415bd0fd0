package org.testnet.universe.node;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.testnet.universe.topology.ServicePorts;
import org.testnet.universe.util.AddressUtils;

import java.util.Optional;

/**
 * Immutable identity of a node: the gossip address other members reach it on, the
 * client-facing rpc address used by the control plane, and any other advertised service
 * endpoints (tpu, tvu, drone, ...).
 * <p>
 * Instances are produced either by gossip discovery, from a validated {@link ContactRecord},
 * or by the deployment orchestrator from a host and the configured {@link ServicePorts}.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class ContactInfo {

    public static final String DRONE_SERVICE = "drone";

    @NonNull
    private final String id;

    @NonNull
    private final String gossipAddress;

    @NonNull
    private final String rpcAddress;

    @Singular
    private final ImmutableMap<String, String> services;

    public Optional<String> getService(String name) {
        return Optional.ofNullable(services.get(name));
    }

    /**
     * Builds the contact of a deployed node from its host and the cluster port layout.
     * The host itself is used as the node id because that is all a deployment knows
     * about a node before it joins gossip.
     */
    public static ContactInfo forHost(String host, ServicePorts ports) {
        return ContactInfo.builder()
                .id(host)
                .gossipAddress(AddressUtils.endpoint(host, ports.getGossipPort()))
                .rpcAddress(AddressUtils.endpoint(host, ports.getRpcPort()))
                .service(DRONE_SERVICE, AddressUtils.endpoint(host, ports.getDronePort()))
                .build();
    }

    /**
     * Converts a raw advertisement into a contact, if and only if it is well formed: it has an
     * id and both its gossip and rpc endpoints are valid network addresses. Other service
     * endpoints that are malformed are dropped rather than invalidating the whole record.
     */
    public static Optional<ContactInfo> fromRecord(ContactRecord record) {
        if (record == null || record.getId() == null || record.getId().trim().isEmpty()) {
            return Optional.empty();
        }

        if (!AddressUtils.isWellFormedEndpoint(record.getGossip())
                || !AddressUtils.isWellFormedEndpoint(record.getRpc())) {
            return Optional.empty();
        }

        ContactInfoBuilder builder = ContactInfo.builder()
                .id(record.getId())
                .gossipAddress(record.getGossip())
                .rpcAddress(record.getRpc());

        record.getServices().forEach((name, endpoint) -> {
            if (AddressUtils.isWellFormedEndpoint(endpoint)) {
                builder.service(name, endpoint);
            }
        });

        return Optional.of(builder.build());
    }
}
