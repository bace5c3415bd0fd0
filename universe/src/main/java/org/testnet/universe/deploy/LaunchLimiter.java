package org.testnet.universe.deploy;

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.testnet.universe.universe.UniverseException;
import org.testnet.universe.util.Pauser;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Throttles how fast follower launches are issued against the bootstrap leader, which serves
 * binaries to every follower.
 * <p>
 * Two independent limits apply: at most {@code maxInFlight} launches run at the same time,
 * and once {@code burstSize} launches have been issued the issuing thread pauses for
 * {@code burstPause} before it issues the next one. No pause follows the last launch of a
 * run. Every submitted launch eventually runs.
 */
@Slf4j
public class LaunchLimiter {

    public static final int DEFAULT_BURST_SIZE = 2;
    public static final Duration DEFAULT_BURST_PAUSE = Duration.ofSeconds(2);
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    @Getter
    private final int burstSize;

    @Getter
    private final Duration burstPause;

    private final Semaphore inFlight;
    private final Pauser pauser;

    private int issued;

    public LaunchLimiter(int burstSize, @NonNull Duration burstPause, int maxInFlight, @NonNull Pauser pauser) {
        Preconditions.checkArgument(burstSize > 0, "Burst size must be positive: %s", burstSize);
        Preconditions.checkArgument(maxInFlight > 0, "Max in flight launches must be positive: %s", maxInFlight);
        Preconditions.checkArgument(!burstPause.isNegative(), "Negative burst pause: %s", burstPause);

        this.burstSize = burstSize;
        this.burstPause = burstPause;
        this.inFlight = new Semaphore(maxInFlight);
        this.pauser = pauser;
    }

    /**
     * Issues a launch on the executor once an in-flight slot is free. The caller is paused
     * first if the previous launches completed a burst.
     */
    public synchronized <T> CompletableFuture<T> submit(@NonNull Supplier<T> launch, @NonNull Executor executor) {
        if (issued > 0 && issued % burstSize == 0 && !burstPause.isZero()) {
            log.debug("Issued {} launches, pausing for {}", issued, burstPause);
            pauser.pause(burstPause);
        }

        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UniverseException("Interrupted while waiting for a launch slot", e);
        }

        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(launch, executor);
        } catch (RuntimeException e) {
            inFlight.release();
            throw e;
        }
        future.whenComplete((result, error) -> inFlight.release());

        issued++;
        return future;
    }

    public synchronized int getIssued() {
        return issued;
    }
}
