package com.example.admission;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * テスト用の手動で進める単調時計 (System.nanoTime の代わり)。
 */
final class ManualTicker implements LongSupplier {

    private volatile long nanos;

    ManualTicker(long startNanos) {
        this.nanos = startNanos;
    }

    void advance(Duration d) {
        nanos += d.toNanos();
    }

    /** 時刻が戻るケースの再現用 */
    void set(long value) {
        nanos = value;
    }

    @Override
    public long getAsLong() {
        return nanos;
    }
}
