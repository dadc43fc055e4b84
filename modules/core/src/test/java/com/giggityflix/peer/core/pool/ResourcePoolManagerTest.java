package com.giggityflix.peer.core.pool;

import com.giggityflix.peer.types.ExecutionPath;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourcePoolManagerTest {

    private final ExecutorService ioExecutor = Executors.newCachedThreadPool();
    private final List<ResourcePoolManager> managers = new ArrayList<>();

    private ResourcePoolManager manager(ResourcePoolConfig config) {
        ResourcePoolManager manager = new ResourcePoolManager(config, ioExecutor);
        managers.add(manager);
        return manager;
    }

    @AfterEach
    void tearDown() {
        for (ResourcePoolManager manager : managers) {
            try {
                manager.shutdown();
            } catch (IllegalStateException ignored) {
                // tests that leak permits on purpose
            }
        }
        ioExecutor.shutdownNow();
    }

    private DeviceLimiter limiter(ResourcePoolManager manager, String device) {
        return manager.registry().existing(DeviceIdentifier.of(device)).orElseThrow();
    }

    // -- CPU recursion --

    private long factorial(ResourcePoolManager manager, int n) throws Exception {
        if (n <= 1) {
            return 1;
        }
        return n * manager.callCpuBound("factorial", () -> factorial(manager, n - 1));
    }

    private Uni<Long> factorialAsync(ResourcePoolManager manager, int n) {
        return manager.runCpuBound("factorial", () ->
                n <= 1 ? 1L : n * factorialAsync(manager, n - 1).await().indefinitely());
    }

    @Test
    void recursiveCpuCallsRunInlineWithSingleWorker() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        long result = manager.callCpuBound("factorial", () -> factorial(manager, 10));

        assertThat(result).isEqualTo(3_628_800L);
        assertThat(manager.metrics().paths().get(ExecutionPath.CPU).completed()).isEqualTo(1);
        assertThat(manager.metrics().paths().get(ExecutionPath.INLINE).completed()).isEqualTo(9);
    }

    @Test
    void recursiveCooperativeCpuCallsRunInlineWithSingleWorker() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        Long result = factorialAsync(manager, 10).await().atMost(Duration.ofSeconds(10));

        assertThat(result).isEqualTo(3_628_800L);
    }

    @Test
    void topLevelCpuCallsRunOnWorkers() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(2, 2));

        String thread = manager.callCpuBound(() -> Thread.currentThread().getName());

        assertThat(thread).startsWith("cpu-worker-");
        assertThat(ExecutionContext.isInside(manager.cpuPool())).isFalse();
    }

    @Test
    void poolFailureIsWrappedButInlineFailureIsNot() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        assertThatThrownBy(() -> manager.callCpuBound("parse", () -> {
            throw new NumberFormatException("not a number");
        }))
                .isInstanceOf(WorkerExecutionException.class)
                .hasCauseInstanceOf(NumberFormatException.class)
                .satisfies(e -> assertThat(((WorkerExecutionException) e).operation()).isEqualTo("parse"));

        assertThatThrownBy(() -> manager.callCpuBound("outer", () ->
                manager.callCpuBound("inner", () -> {
                    throw new NumberFormatException("inline");
                })))
                .isInstanceOf(WorkerExecutionException.class)
                .hasCauseExactlyInstanceOf(NumberFormatException.class);
    }

    @Test
    void workerSurvivesFailureAndServesLaterCalls() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        assertThatThrownBy(() -> manager.runCpuBound(() -> {
            throw new IllegalStateException("first");
        }).await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(WorkerExecutionException.class);

        assertThat(manager.callCpuBound(() -> 42)).isEqualTo(42);
    }

    @Test
    void errorFromCallableLeavesPoolUsable() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        assertThatThrownBy(() -> manager.runCpuBound(() -> {
            throw new AssertionError("boom");
        }).await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(WorkerExecutionException.class)
                .hasCauseInstanceOf(AssertionError.class);

        assertThat(manager.cpuPool().liveWorkers()).isEqualTo(1);
        assertThat(manager.runCpuBound(() -> 42).await().atMost(Duration.ofSeconds(5))).isEqualTo(42);
        assertThat(manager.metrics().paths().get(ExecutionPath.CPU).failed()).isEqualTo(1);
    }

    @Test
    void cancellingCooperativeCpuCallInterruptsWorker() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        Cancellable subscription = manager.runCpuBound(() -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }).subscribe().with(item -> {}, failure -> {});

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        subscription.cancel();

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(manager.callCpuBound(() -> "next")).isEqualTo("next");
    }

    // -- IO gating --

    @Test
    void ioCallsNeverExceedDeviceLimit() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                int n = i;
                futures.add(callers.submit(() -> manager.callIoBound("read", "/data/file-" + n, () -> {
                    peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                    Thread.sleep(30);
                    running.decrementAndGet();
                    return n;
                })));
            }
            for (int i = 0; i < 6; i++) {
                assertThat(futures.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(i);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(peak.get()).isBetween(1, 2);
        assertThat(limiter(manager, "/").inFlight()).isZero();
    }

    @Test
    void cooperativeIoCallsNeverExceedDeviceLimit() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1)
                .withMountPoints(List.of("/mnt/slow")));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<Uni<Integer>> unis = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            int n = i;
            unis.add(manager.runIoBound("read", "/mnt/slow/" + n, () -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                Thread.sleep(20);
                running.decrementAndGet();
                return n;
            }));
        }
        List<?> results = Uni.join().all(unis).andFailFast().await().atMost(Duration.ofSeconds(10));

        assertThat(results).hasSize(4);
        assertThat(peak.get()).isEqualTo(1);
        assertThat(limiter(manager, "/mnt/slow").inFlight()).isZero();
    }

    @Test
    void failingIoCallsNeverLockOutDevice() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> manager.callIoBound("read", "/disk/file", () -> {
                throw new IOException("disk error");
            })).isInstanceOf(IOException.class);
        }
        assertThatThrownBy(() -> manager.runIoBound("/disk/file", () -> {
            throw new IllegalStateException("corrupt");
        }).await().atMost(Duration.ofSeconds(5))).isInstanceOf(IllegalStateException.class);

        assertThat(manager.callIoBound("/disk/file", () -> "ok")).isEqualTo("ok");
        assertThat(limiter(manager, "/").inFlight()).isZero();
    }

    @Test
    void cancellingQueuedIoCallFreesItsPlace() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));
        DevicePermit held = manager.registry().acquire("/a");
        AtomicInteger ran = new AtomicInteger();

        Cancellable subscription = manager.runIoBound("/b", ran::incrementAndGet)
                .subscribe().with(item -> {}, failure -> {});
        assertThat(limiter(manager, "/").waiting()).isEqualTo(1);

        subscription.cancel();
        held.close();

        assertThat(limiter(manager, "/").waiting()).isZero();
        assertThat(limiter(manager, "/").inFlight()).isZero();
        assertThat(ran.get()).isZero();
    }

    @Test
    void cancellingRunningIoCallReleasesPermit() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Cancellable subscription = manager.runIoBound("/slow", () -> {
            started.countDown();
            return release.await(5, TimeUnit.SECONDS);
        }).subscribe().with(item -> {}, failure -> {});
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        subscription.cancel();

        assertThat(limiter(manager, "/").inFlight()).isZero();
        release.countDown();
        assertThat(manager.callIoBound("/slow", () -> "free")).isEqualTo("free");
    }

    @Test
    void asyncIoBodyHoldsPermitUntilItTerminates() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));

        String result = manager.runIoBoundAsync("/async", () -> {
            assertThat(limiter(manager, "/").inFlight()).isEqualTo(1);
            return Uni.createFrom().item("done");
        }).await().atMost(Duration.ofSeconds(5));

        assertThat(result).isEqualTo("done");
        assertThat(limiter(manager, "/").inFlight()).isZero();
    }

    @Test
    void boundedWaitTimesOut() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1)
                .withAcquireTimeout(Duration.ofMillis(100)));
        DevicePermit held = manager.registry().acquire("/busy");

        assertThatThrownBy(() -> manager.callIoBound("/busy/file", () -> "never"))
                .isInstanceOf(PoolSaturationTimeoutException.class);
        assertThatThrownBy(() -> manager.runIoBound("/busy/file", () -> "never")
                .await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(PoolSaturationTimeoutException.class);

        held.close();
        assertThat(limiter(manager, "/").waiting()).isZero();
    }

    @Test
    void invalidPathFailsOnlyTheCall() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));

        assertThatThrownBy(() -> manager.callIoBound("", () -> "x"))
                .isInstanceOf(InvalidDevicePathException.class);
        assertThatThrownBy(() -> manager.runIoBound("", () -> "x").await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(InvalidDevicePathException.class);
        assertThat(manager.callIoBound("/fine", () -> "y")).isEqualTo("y");
    }

    // -- administration and shutdown --

    @Test
    void resizingIsVisibleThroughManager() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(2, 2));

        manager.resizeCpuPool(4);
        manager.resizeDeviceLimit("D:", 6);

        assertThat(manager.cpuPoolSize()).isEqualTo(4);
        assertThat(manager.ioLimits()).containsEntry("D:", 6);
        assertThat(manager.deviceFor("d:\\movies").value()).isEqualTo("D:");
    }

    @Test
    void shutdownIsIdempotentAndRejectsNewWork() {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 1));

        manager.shutdown();
        manager.shutdown();

        assertThat(manager.isShutdown()).isTrue();
        assertThatThrownBy(() -> manager.callCpuBound(() -> 1))
                .isInstanceOf(ShutdownInProgressException.class);
        assertThatThrownBy(() -> manager.callIoBound("/x", () -> 1))
                .isInstanceOf(ShutdownInProgressException.class);
        assertThatThrownBy(() -> manager.runIoBound("/x", () -> 1).await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(ShutdownInProgressException.class);
        assertThatThrownBy(() -> manager.runCpuBound(() -> 1).await().atMost(Duration.ofSeconds(5)))
                .isInstanceOf(ShutdownInProgressException.class);
    }

    @Test
    void shutdownSurfacesLeakedPermits() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));
        manager.registry().acquire("/leaked/file");

        assertThatThrownBy(manager::shutdown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("/");
    }

    @Test
    void metricsTrackEachPath() throws Exception {
        ResourcePoolManager manager = manager(ResourcePoolConfig.of(1, 2));

        manager.callIoBound("/m", () -> 1);
        manager.callCpuBound(() -> 2);
        manager.runAsync("async", () -> Uni.createFrom().item(3)).await().atMost(Duration.ofSeconds(5));
        assertThatThrownBy(() -> manager.callCpuBound(() -> {
            throw new IllegalStateException("x");
        })).isInstanceOf(WorkerExecutionException.class);

        PoolMetricsSnapshot snapshot = manager.metrics();
        assertThat(snapshot.paths().get(ExecutionPath.IO).completed()).isEqualTo(1);
        assertThat(snapshot.paths().get(ExecutionPath.ASYNC).completed()).isEqualTo(1);
        assertThat(snapshot.paths().get(ExecutionPath.CPU).submitted()).isEqualTo(2);
        assertThat(snapshot.paths().get(ExecutionPath.CPU).failed()).isEqualTo(1);
        assertThat(snapshot.workerCount()).isEqualTo(1);
        assertThat(snapshot.deviceInFlight()).containsEntry("/", 0);
    }
}
