package org.testnet.universe.scenario;

/**
 * Signs transfers on behalf of a funded credential. The key material stays with the owner
 * of the credential; the harness only ever sees signed transfers.
 */
public interface TransferSigner {

    /**
     * Public key of a fresh, unfunded account to transfer to.
     */
    String newRecipient();

    SignedTransfer signTransfer(String recipient, long lamports, String recentBlockhash);
}
