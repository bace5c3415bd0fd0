package org.testnet.universe.node;

import com.google.common.collect.ImmutableMap;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * A raw gossip advertisement as it travels on the control plane.
 * <p>
 * Nothing about a record is validated: the control plane may push arbitrary, even malformed,
 * records into a node's gossip table, and nodes may advertise such records back during
 * discovery. Use {@link ContactInfo#fromRecord(ContactRecord)} to obtain a validated contact.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ContactRecord {
    private final String id;
    private final String gossip;
    private final String rpc;
    private final Map<String, String> services;

    public ContactRecord(String id, String gossip, String rpc) {
        this(id, gossip, rpc, ImmutableMap.of());
    }

    public Map<String, String> getServices() {
        return services == null ? ImmutableMap.of() : services;
    }

    public static ContactRecord of(ContactInfo contact) {
        return new ContactRecord(
                contact.getId(),
                contact.getGossipAddress(),
                contact.getRpcAddress(),
                contact.getServices()
        );
    }
}
