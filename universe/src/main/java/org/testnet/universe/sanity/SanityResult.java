package org.testnet.universe.sanity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Outcome of one sanity battery.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SanityResult {

    @NonNull
    private final String host;

    @NonNull
    private final ImmutableList<SanityCheck> passed;

    @NonNull
    private final ImmutableList<SanityCheck> skipped;

    /**
     * Reason of every failed check.
     */
    @NonNull
    private final ImmutableMap<SanityCheck, String> failures;

    public boolean isPassed() {
        return failures.isEmpty();
    }

    public ImmutableList<SanityCheck> getExecuted() {
        return ImmutableList.<SanityCheck>builder()
                .addAll(passed)
                .addAll(failures.keySet())
                .build();
    }
}
