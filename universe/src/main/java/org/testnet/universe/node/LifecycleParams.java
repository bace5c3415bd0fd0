package org.testnet.universe.node;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Remote layout and kill policy used by {@link NodeLifecycleController}.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class LifecycleParams {

    public static final LifecycleParams DEFAULT = LifecycleParams.builder().build();

    /**
     * Launcher of fullnode roles, relative to the remote project directory.
     */
    @Default
    @NonNull
    private final String nodeLauncher = "net/remote/remote-node.sh";

    /**
     * Launcher of the client role, relative to the remote project directory.
     */
    @Default
    @NonNull
    private final String clientLauncher = "net/remote/remote-client.sh";

    /**
     * Process name patterns killed after the tracked process groups, as a last resort for
     * processes that escaped their group.
     */
    @Default
    @NonNull
    private final ImmutableList<String> fallbackPatterns = ImmutableList.of("node", "solana-", "remote-");

    /**
     * Files, relative to the remote project directory, in which the launcher records the
     * process ids of the monitors it starts as root. Their whole process groups are killed.
     */
    @Default
    @NonNull
    private final ImmutableList<String> auxiliaryPidFiles = ImmutableList.of("net-stats.pid", "oom-monitor.pid");
}
