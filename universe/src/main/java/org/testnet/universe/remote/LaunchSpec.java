package org.testnet.universe.remote;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * A process to launch on a remote host in its own process group.
 */
@Builder
@Getter
@EqualsAndHashCode
@ToString
public class LaunchSpec {

    /**
     * Key under which the process group is tracked on the host, e.g. "fullnode".
     */
    @NonNull
    private final String name;

    /**
     * Launcher path, relative to the remote project directory.
     */
    @NonNull
    private final String launcher;

    @Singular
    private final ImmutableList<String> args;

    @Singular("env")
    private final ImmutableMap<String, String> environment;
}
