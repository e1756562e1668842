package com.example.admission;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 同じキーに同時にリクエストが来ても、許可されるのはちょうど min(N, capacity) 件。
 * 時計は止めてあるので補充は起きない。
 */
class TokenBucketStoreConcurrencyTest {

    private static final int THREADS = 32;
    private static final int TRIALS = 200;

    private ExecutorService pool;
    private TokenBucketStore store;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(THREADS);

        RateLimitProperties props = new RateLimitProperties();
        props.setCapacity(10);
        props.setWindowSeconds(60);
        store = new TokenBucketStore(props, new SimpleMeterRegistry(),
                new ManualTicker(0L));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    private int admittedOutOf(String key, int requests) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < requests; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return store.allow(key).allowed();
            }));
        }
        // 全員そろってから一斉にスタート
        start.countDown();

        int admitted = 0;
        for (Future<Boolean> f : futures) {
            if (f.get(10, TimeUnit.SECONDS)) admitted++;
        }
        return admitted;
    }

    @Test
    void moreRequestsThanTokensAdmitsExactlyCapacity() throws Exception {
        for (int trial = 0; trial < TRIALS; trial++) {
            String key = "burst-" + trial;

            assertThat(admittedOutOf(key, THREADS)).as("trial %d", trial).isEqualTo(10);
            assertThat(store.snapshot(key)).hasValueSatisfying(s -> assertThat(s.tokens()).isZero());
        }
    }

    @Test
    void fewerRequestsThanTokensAreAllAdmitted() throws Exception {
        for (int trial = 0; trial < TRIALS; trial++) {
            String key = "light-" + trial;

            assertThat(admittedOutOf(key, 6)).as("trial %d", trial).isEqualTo(6);
            assertThat(store.snapshot(key)).hasValueSatisfying(s -> assertThat(s.tokens()).isEqualTo(4));
        }
    }

    @Test
    void concurrentFirstSightCreatesASingleBucket() throws Exception {
        for (int trial = 0; trial < TRIALS; trial++) {
            admittedOutOf("new-" + trial, THREADS);
        }

        assertThat(store.size()).isEqualTo(TRIALS);
    }
}
