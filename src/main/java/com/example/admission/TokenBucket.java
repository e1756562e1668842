package com.example.admission;

import java.math.BigInteger;

/**
 * キー1つ分のトークンバケット。
 * capacity: バースト容量
 * windowNanos: capacity 個が全回復する時間
 *
 * 時刻はすべて単調増加のナノ秒 (System.nanoTime 相当) で持つ。壁時計がずれても影響しない。
 * 自分ではロックを持たない。TokenBucketStore がマップのキー単位ロック
 * (ConcurrentHashMap.compute) の中からだけ触る。
 */
final class TokenBucket {
    private final int capacity;
    private final long windowNanos;

    // トークンは整数で持つ。端数は lastRefillNanos からの経過時間として残る
    private int tokens;
    private long lastRefillNanos;
    private long lastAccessNanos;

    /**
     * 初めて見たキー用。作った瞬間に1トークン使った状態 (capacity - 1) で始める。
     */
    TokenBucket(int capacity, long windowNanos, long nowNanos) {
        this.capacity = capacity;
        this.windowNanos = windowNanos;
        this.tokens = capacity - 1;
        this.lastRefillNanos = nowNanos;
        this.lastAccessNanos = nowNanos;
    }

    /** 作成時の1回目の判定 (常に許可) */
    AllowResult firstDecision() {
        return new AllowResult(true, tokens, 0L);
    }

    /**
     * 補充してから1トークン消費を試みる。
     */
    AllowResult takeOne(long nowNanos) {
        refill(nowNanos);
        lastAccessNanos = nowNanos;

        if (tokens > 0) {
            tokens--;
            return new AllowResult(true, tokens, 0L);
        }
        return new AllowResult(false, 0L, secondsToNextToken(nowNanos));
    }

    /**
     * 経過時間から整数トークンを足す。
     * 0トークンしか増えない時は lastRefillNanos を動かさない (端数の経過時間を捨てないため)。
     */
    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed < 0) {
            // 時刻が戻った場合は起点を今に付け替える。未来の起点を待ち続けないように
            lastRefillNanos = nowNanos;
            return;
        }
        if (elapsed == 0) return;

        long tokensToAdd = elapsed >= windowNanos ? capacity : wholeTokens(elapsed);

        if (tokensToAdd > 0) {
            tokens = (int) Math.min(capacity, tokens + tokensToAdd);
            lastRefillNanos = nowNanos;
        }
    }

    // floor(elapsedNanos * capacity / windowNanos) を浮動小数点なしで計算する
    private long wholeTokens(long elapsedNanos) {
        long high = Math.multiplyHigh(elapsedNanos, capacity);
        long low = elapsedNanos * capacity;
        if (high == 0 && low >= 0) {
            return low / windowNanos;
        }
        return BigInteger.valueOf(elapsedNanos)
                .multiply(BigInteger.valueOf(capacity))
                .divide(BigInteger.valueOf(windowNanos))
                .longValueExact();
    }

    private long secondsToNextToken(long nowNanos) {
        // 1トークン分の時間 = ceil(windowNanos / capacity)
        long nanosPerToken = (windowNanos + capacity - 1) / capacity;
        long elapsed = Math.max(0L, nowNanos - lastRefillNanos);
        long waitNanos = Math.max(0L, nanosPerToken - elapsed);
        return Math.max(1L, (long) Math.ceil(waitNanos / 1_000_000_000.0));
    }

    boolean idleFor(long nowNanos, long idleNanos) {
        return nowNanos - lastAccessNanos >= idleNanos;
    }

    BucketSnapshot snapshot() {
        return new BucketSnapshot(tokens, lastRefillNanos);
    }
}
