package org.testnet.universe.topology;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Port layout shared by every node of a cluster.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class ServicePorts {
    public static final ServicePorts DEFAULT = ServicePorts.builder().build();

    @Default
    private final int gossipPort = 8001;

    @Default
    private final int rpcPort = 8899;

    @Default
    private final int dronePort = 9900;
}
