package org.testnet.universe.sanity;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Independent switches of the sanity battery. No option implies or disables another.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class SanityOptions {

    public static final String NO_LEDGER_VERIFY = "noLedgerVerify";
    public static final String NO_VALIDATOR_SANITY = "noValidatorSanity";
    public static final String REJECT_EXTRA_NODES = "rejectExtraNodes";

    public static final SanityOptions DEFAULT = SanityOptions.builder().build();

    @Default
    private final boolean skipLedgerVerify = false;

    @Default
    private final boolean skipValidatorSanity = false;

    /**
     * Fail the node count check when more nodes than expected are found.
     */
    @Default
    private final boolean rejectExtraNodes = false;

    /**
     * Parses command line options.
     *
     * @throws IllegalArgumentException on an unknown option
     */
    public static SanityOptions parse(List<String> options) {
        SanityOptionsBuilder builder = SanityOptions.builder();
        for (String option : options) {
            switch (option) {
                case NO_LEDGER_VERIFY:
                    builder.skipLedgerVerify(true);
                    break;
                case NO_VALIDATOR_SANITY:
                    builder.skipValidatorSanity(true);
                    break;
                case REJECT_EXTRA_NODES:
                    builder.rejectExtraNodes(true);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + option);
            }
        }
        return builder.build();
    }
}
