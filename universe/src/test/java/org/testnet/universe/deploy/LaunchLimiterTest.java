package org.testnet.universe.deploy;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.Test;
import org.testnet.universe.util.Pauser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LaunchLimiterTest {

    @Test
    public void pausesBetweenBursts() {
        List<String> events = new ArrayList<>();
        Pauser pauser = duration -> events.add("pause " + duration.toMillis());
        LaunchLimiter limiter = new LaunchLimiter(2, Duration.ofSeconds(2), LaunchLimiter.UNBOUNDED, pauser);

        for (int i = 0; i < 5; i++) {
            int launch = i;
            limiter.submit(() -> events.add("launch " + launch), MoreExecutors.directExecutor()).join();
        }

        assertThat(events).containsExactly(
                "launch 0", "launch 1", "pause 2000",
                "launch 2", "launch 3", "pause 2000",
                "launch 4"
        );
        assertThat(limiter.getIssued()).isEqualTo(5);
    }

    @Test
    public void noPauseAfterLastBurst() {
        List<String> events = new ArrayList<>();
        LaunchLimiter limiter = new LaunchLimiter(2, Duration.ofSeconds(2), LaunchLimiter.UNBOUNDED,
                duration -> events.add("pause"));

        for (int i = 0; i < 4; i++) {
            int launch = i;
            limiter.submit(() -> events.add("launch " + launch), MoreExecutors.directExecutor()).join();
        }

        assertThat(events).containsExactly("launch 0", "launch 1", "pause", "launch 2", "launch 3");
    }

    @Test
    public void zeroPauseNeverPauses() {
        AtomicInteger pauses = new AtomicInteger();
        LaunchLimiter limiter = new LaunchLimiter(1, Duration.ZERO, LaunchLimiter.UNBOUNDED,
                duration -> pauses.incrementAndGet());

        for (int i = 0; i < 3; i++) {
            limiter.submit(() -> null, MoreExecutors.directExecutor()).join();
        }

        assertThat(pauses).hasValue(0);
    }

    @Test
    public void boundsLaunchesInFlight() throws Exception {
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            LaunchLimiter limiter = new LaunchLimiter(100, Duration.ZERO, 2, duration -> { });
            AtomicInteger running = new AtomicInteger();
            AtomicInteger maxRunning = new AtomicInteger();
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<Void> issuing = CompletableFuture.runAsync(() -> {
                List<CompletableFuture<Object>> launches = new ArrayList<>();
                for (int i = 0; i < 6; i++) {
                    launches.add(limiter.submit(() -> {
                        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                        try {
                            release.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        running.decrementAndGet();
                        return null;
                    }, executor));
                }
                launches.forEach(CompletableFuture::join);
            }, executor);

            TimeUnit.MILLISECONDS.sleep(200);
            assertThat(running).hasValue(2);

            release.countDown();
            issuing.get(10, TimeUnit.SECONDS);

            assertThat(limiter.getIssued()).isEqualTo(6);
            assertThat(maxRunning.get()).isLessThanOrEqualTo(2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void failedLaunchFreesItsSlot() {
        LaunchLimiter limiter = new LaunchLimiter(10, Duration.ZERO, 1, duration -> { });

        CompletableFuture<Object> failed = limiter.submit(() -> {
            throw new IllegalStateException("boom");
        }, MoreExecutors.directExecutor());
        CompletableFuture<String> next = limiter.submit(() -> "ok", MoreExecutors.directExecutor());

        assertThat(failed).isCompletedExceptionally();
        assertThat(next.join()).isEqualTo("ok");
    }

    @Test
    public void rejectsInvalidLimits() {
        assertThatThrownBy(() -> new LaunchLimiter(0, Duration.ZERO, 1, duration -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LaunchLimiter(1, Duration.ZERO, 0, duration -> { }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LaunchLimiter(1, Duration.ofSeconds(-1), 1, duration -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
