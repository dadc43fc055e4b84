package com.giggityflix.peer.test;

import com.giggityflix.peer.core.pool.DeviceIdentifier;
import com.giggityflix.peer.core.pool.ResourcePoolService;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@QuarkusTest
class ResourceAnnotationTest {

    @Inject
    GatedOperations operations;

    @Inject
    ResourcePoolService resourcePool;

    @BeforeEach
    void setUp() {
        operations.resetPeak();
    }

    @Test
    void ioBoundRespectsDeviceLimit() throws Exception {
        // /mnt/slow is configured with a limit of 1
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String path = "/mnt/slow/file-" + i;
                results.add(callers.submit(() -> operations.read(path, 50)));
            }
            for (int i = 0; i < 4; i++) {
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo("read:/mnt/slow/file-" + i);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(operations.peak()).isEqualTo(1);
        assertThat(resourcePool.manager().registry()
                .existing(DeviceIdentifier.of("/mnt/slow")).orElseThrow().inFlight()).isZero();
    }

    @Test
    void ioBoundWithoutPathRunsUngated() throws Exception {
        assertThat(operations.read(null, 0)).isEqualTo("read:null");
    }

    @Test
    void devicePathAnnotationSelectsParameter() {
        assertThat(operations.write("/mnt/fast/out.bin", "abc"))
                .isEqualTo("wrote 3 bytes to /mnt/fast/out.bin");
        assertThat(resourcePool.manager().registry()
                .existing(DeviceIdentifier.of("/mnt/fast"))).isPresent();
    }

    @Test
    void ioBoundUniReleasesPermitOnCompletion() {
        String result = operations.readAsync("/mnt/slow/async.txt")
                .await().atMost(Duration.ofSeconds(5));

        assertThat(result).isEqualTo("async:/mnt/slow/async.txt");
        assertThat(resourcePool.manager().registry()
                .existing(DeviceIdentifier.of("/mnt/slow")).orElseThrow().inFlight()).isZero();
    }

    @Test
    void ioBoundWithoutMatchingParameterFails() {
        assertThatThrownBy(() -> operations.missingPathParameter("x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("location");
    }

    @Test
    void cpuBoundRunsOnWorker() {
        assertThat(operations.workerThreadName()).startsWith("cpu-worker-");
    }

    @Test
    void cpuBoundRethrowsOriginalException() {
        assertThatThrownBy(() -> operations.rejectInput(7))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad input: 7");

        // the worker survived the failure
        assertThat(operations.workerThreadName()).startsWith("cpu-worker-");
    }
}
