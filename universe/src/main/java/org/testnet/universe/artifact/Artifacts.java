package org.testnet.universe.artifact;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Resolved, ready to push deployment artifacts.
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class Artifacts {

    @NonNull
    private final DeployMethod deployMethod;

    /**
     * Node binaries, installed on the bootstrap leader only.
     */
    @Singular
    private final ImmutableList<Path> binaries;

    /**
     * Scripts and launchers, installed on every node.
     */
    @Singular
    private final ImmutableList<Path> supportFiles;

    /**
     * Release version or source revision, "unknown" variants when it can't be determined.
     */
    @NonNull
    private final String version;
}
