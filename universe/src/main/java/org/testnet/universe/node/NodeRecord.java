package org.testnet.universe.node;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.topology.ServicePorts;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One node of a deployment run: where it lives, what it does, where its log goes and which
 * lifecycle state it is in.
 * <p>
 * The address, role and log handle never change. The state and the supervised process groups
 * are mutated exclusively by {@link NodeLifecycleController}.
 */
@Slf4j
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NodeRecord {

    @Getter
    @NonNull
    @EqualsAndHashCode.Include
    private final String host;

    @Getter
    @NonNull
    @EqualsAndHashCode.Include
    private final NodeRole role;

    @Getter
    @NonNull
    private final Path logFile;

    @Getter
    private volatile NodeState state = NodeState.PENDING;

    @ToString.Exclude
    private final List<Long> processGroups = new CopyOnWriteArrayList<>();

    public NodeRecord(@NonNull String host, @NonNull NodeRole role, @NonNull Path logFile) {
        this.host = host;
        this.role = role;
        this.logFile = logFile;
    }

    /**
     * A fresh record for the same host, used when a node is replaced during update-in-place.
     */
    public NodeRecord replacement() {
        return new NodeRecord(host, role, logFile);
    }

    public ContactInfo contact(ServicePorts ports) {
        return ContactInfo.forHost(host, ports);
    }

    public ImmutableList<Long> getProcessGroups() {
        return ImmutableList.copyOf(processGroups);
    }

    void addProcessGroup(long processGroup) {
        processGroups.add(processGroup);
    }

    void clearProcessGroups() {
        processGroups.clear();
    }

    /**
     * Moves the record to the next state if the transition is legal.
     *
     * @return true if the record is now in the requested state
     */
    synchronized boolean transitionTo(NodeState next) {
        if (!state.canTransitionTo(next)) {
            log.warn("Illegal state transition of {} {}: {} -> {}", role, host, state, next);
            return false;
        }

        if (state != next) {
            log.debug("Node {} {}: {} -> {}", role, host, state, next);
        }
        state = next;
        return true;
    }
}
