package org.testnet.universe.scenario;

import com.google.common.base.Stopwatch;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.rpc.ControlPlaneClient;

import java.time.Duration;

@Slf4j
public final class ScenarioUtils {

    private ScenarioUtils() {
        // prevent instantiation of this class
    }

    /**
     * Transfers lamports from the funded credential to a fresh account through one node.
     *
     * @return the transaction signature
     */
    public static String transfer(ControlPlaneClient node, FundedCredential funder, long lamports) {
        TransferSigner signer = funder.getSigner();
        String blockhash = node.getRecentBlockhash();
        SignedTransfer transfer = signer.signTransfer(signer.newRecipient(), lamports, blockhash);

        String signature = node.sendTransaction(transfer.getEncodedTransaction());
        log.debug("Sent {} lamports through {}: {}", lamports, node.getEndpoint(), signature);
        return signature;
    }

    /**
     * Polls the node until the transaction is confirmed.
     *
     * @throws ScenarioException if the transaction is not confirmed within the harness'
     *                           confirmation timeout
     */
    public static void waitForConfirmation(ScenarioHarness harness, ControlPlaneClient node, String signature) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Duration timeout = harness.getConfirmationTimeout();

        while (!node.confirmTransaction(signature)) {
            if (stopwatch.elapsed().compareTo(timeout) >= 0) {
                throw new ScenarioException("Transaction " + signature + " not confirmed by "
                        + node.getEndpoint() + " within " + timeout);
            }
            harness.pause(harness.getConfirmationPollInterval());
        }

        log.debug("Transaction {} confirmed by {} after {}", signature, node.getEndpoint(), stopwatch);
    }

    public static void transferAndConfirm(ScenarioHarness harness, ControlPlaneClient node,
                                          FundedCredential funder, long lamports) {
        waitForConfirmation(harness, node, transfer(node, funder, lamports));
    }
}
