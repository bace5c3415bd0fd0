package org.testnet.universe.artifact;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How the binaries of a run were produced, as reported to the remote launchers.
 */
@AllArgsConstructor
public enum DeployMethod {
    LOCAL("local"),
    TAR("tar");

    @Getter
    private final String launchName;
}
