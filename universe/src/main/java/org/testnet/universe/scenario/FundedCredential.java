package org.testnet.universe.scenario;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * An account with a known balance that scenarios may spend from. Owned by the caller of a
 * scenario and read-only to the harness.
 */
@Builder
@Getter
@ToString
public class FundedCredential {

    @NonNull
    private final String publicKey;

    /**
     * Balance the account was funded with, in lamports.
     */
    private final long balance;

    @NonNull
    @ToString.Exclude
    private final TransferSigner signer;
}
