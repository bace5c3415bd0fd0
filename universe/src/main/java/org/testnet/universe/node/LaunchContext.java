package org.testnet.universe.node;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * What every node of one deployment run is told at launch: where the bootstrap leader is and
 * how many fullnodes the cluster should have.
 */
@Builder
@Getter
@ToString
public class LaunchContext {

    @NonNull
    private final String entryPointHost;

    private final int nodeCount;
}
