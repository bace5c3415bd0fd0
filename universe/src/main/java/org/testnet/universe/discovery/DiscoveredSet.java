package org.testnet.universe.discovery;

import com.google.common.collect.ImmutableList;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.testnet.universe.node.ContactInfo;

import java.time.Duration;

/**
 * The members a discovery observed. A lower bound of the cluster membership at one point in
 * time, never more than the expected count.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class DiscoveredSet {

    /**
     * Valid, distinct members in the order they were first seen.
     */
    @NonNull
    private final ImmutableList<ContactInfo> members;

    private final int expectedCount;

    /**
     * True if the window ran out before the expected count was reached.
     */
    private final boolean windowExpired;

    @NonNull
    private final Duration elapsed;

    public int size() {
        return members.size();
    }

    public boolean isComplete() {
        return members.size() >= expectedCount;
    }
}
