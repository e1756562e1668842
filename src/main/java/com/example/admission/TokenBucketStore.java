package com.example.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 単一プロセス用のレートリミッター。
 * アプリ内メモリ (ConcurrentHashMap) にAPIキーごとのトークンバケットを保持する。
 *
 * 1キー分の「補充 → 判定 → 消費」は ConcurrentHashMap.compute の中で行うので、
 * 同じキーへの同時リクエストが同じトークンを二重に使うことはない。
 * 新しいキーの作成も compute の中なので、同時に初見でも作られるバケツは1つだけ。
 */
@Service
public class TokenBucketStore implements RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketStore.class);

    private final int capacity;
    private final long windowNanos;
    private final Duration idleEvictAfter;
    private final LongSupplier nanoTime;
    private final Counter allowedCounter;
    private final Counter deniedCounter;

    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketStore(RateLimitProperties props, MeterRegistry registry, LongSupplier nanoTime) {
        if (props.getCapacity() <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + props.getCapacity());
        }
        if (props.getWindowSeconds() <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive: " + props.getWindowSeconds());
        }
        this.capacity = props.getCapacity();
        this.windowNanos = Duration.ofSeconds(props.getWindowSeconds()).toNanos();
        this.idleEvictAfter = idleThreshold(props);
        this.nanoTime = nanoTime;

        this.allowedCounter = Counter.builder("ratelimiter_requests_total")
                .tag("outcome", "allowed")
                .register(registry);
        this.deniedCounter = Counter.builder("ratelimiter_requests_total")
                .tag("outcome", "denied")
                .register(registry);
        Gauge.builder("ratelimiter_buckets", buckets, Map::size)
                .description("Number of API keys currently tracked")
                .register(registry);

        log.info("Token bucket store: capacity={} windowSeconds={} idleEvict={}",
                capacity, props.getWindowSeconds(), idleEvictAfter == null ? "disabled" : idleEvictAfter);
    }

    // 1ウィンドウ以上放置されたバケツは満タンに戻っているはずなので、
    // それより短い閾値で消すと判定結果が変わってしまう
    private static Duration idleThreshold(RateLimitProperties props) {
        long idleSec = props.getIdleEvictSeconds();
        if (idleSec <= 0) return null;
        if (idleSec < props.getWindowSeconds()) {
            log.warn("ratelimit.idle-evict-seconds={} is shorter than the window, using {} instead",
                    idleSec, props.getWindowSeconds());
            idleSec = props.getWindowSeconds();
        }
        return Duration.ofSeconds(idleSec);
    }

    @Override
    public AllowResult allow(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }

        AllowResult[] result = new AllowResult[1];
        buckets.compute(key, (k, bucket) -> {
            long now = nanoTime.getAsLong();
            if (bucket == null) {
                TokenBucket created = new TokenBucket(capacity, windowNanos, now);
                result[0] = created.firstDecision();
                return created;
            }
            result[0] = bucket.takeOne(now);
            return bucket;
        });

        AllowResult res = result[0];
        if (res.allowed()) {
            allowedCounter.increment();
        } else {
            deniedCounter.increment();
        }
        return res;
    }

    @Override
    public Optional<BucketSnapshot> snapshot(String key) {
        BucketSnapshot[] snap = new BucketSnapshot[1];
        buckets.computeIfPresent(key, (k, bucket) -> {
            snap[0] = bucket.snapshot();
            return bucket;
        });
        return Optional.ofNullable(snap[0]);
    }

    @Override
    public int size() {
        return buckets.size();
    }

    /**
     * 一定時間アクセスのないバケツを削除する。idle-evict-seconds=0 なら何もしない。
     *
     * @return 削除した件数
     */
    @Scheduled(fixedDelayString = "${ratelimit.sweep-interval-ms:60000}")
    public int evictIdle() {
        // 戻り値はテストでしか使わない (@Scheduled からの呼び出しでは捨てられる)
        if (idleEvictAfter == null) return 0;

        long now = nanoTime.getAsLong();
        long idleNanos = idleEvictAfter.toNanos();
        int evicted = 0;
        for (String key : buckets.keySet()) {
            boolean[] removed = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.idleFor(now, idleNanos)) {
                    removed[0] = true;
                    return null;
                }
                return bucket;
            });
            if (removed[0]) evicted++;
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle buckets, {} remaining", evicted, buckets.size());
        }
        return evicted;
    }
}
