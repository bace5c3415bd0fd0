package org.testnet.universe.scenario;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A transfer signed by a funded credential, ready to submit.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SignedTransfer {

    @NonNull
    private final String signature;

    /**
     * Wire encoding accepted by sendTransaction.
     */
    @NonNull
    private final String encodedTransaction;
}
