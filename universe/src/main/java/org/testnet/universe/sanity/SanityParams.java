package org.testnet.universe.sanity;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.time.Duration;

/**
 * How the sanity checks reach into a node.
 */
@Builder(toBuilder = true)
@Getter
@ToString
public class SanityParams {

    public static final SanityParams DEFAULT = SanityParams.builder().build();

    /**
     * Verifies the ledger of the node, run inside the node's project directory.
     */
    @Default
    @NonNull
    private final ImmutableList<String> ledgerVerifyCommand = ImmutableList.of(
            "solana-ledger-tool", "--ledger", "config-local/bootstrap-leader-ledger", "verify"
    );

    @Default
    @NonNull
    private final Duration ledgerVerifyTimeout = Duration.ofMinutes(5);
}
