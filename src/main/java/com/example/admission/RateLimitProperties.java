package com.example.admission;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * レートリミッター設定値 (起動時に一度だけ読む。実行中の変更はしない)。
 *
 * capacity 個のトークンが windowSeconds 秒で全回復する。
 * 例: capacity=5, windowSeconds=60 → 12秒ごとに1トークン。
 */
@Validated
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {
    /** バースト容量（トークンの最大保持量） */
    @Positive
    private int capacity = 5;

    /** capacity 個のトークンが全回復するまでの秒数 */
    @Positive
    private int windowSeconds = 60;

    /**
     * 使われなくなったバケツを掃除するまでの秒数 (0で無効)。
     * windowSeconds より短い値は windowSeconds に切り上げる。
     */
    @Min(0)
    private long idleEvictSeconds = 0L;

    /** 掃除を走らせる間隔 (ミリ秒) */
    @Positive
    private long sweepIntervalMs = 60_000L;

    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }

    public int getWindowSeconds() { return windowSeconds; }
    public void setWindowSeconds(int windowSeconds) { this.windowSeconds = windowSeconds; }

    public long getIdleEvictSeconds() { return idleEvictSeconds; }
    public void setIdleEvictSeconds(long idleEvictSeconds) { this.idleEvictSeconds = idleEvictSeconds; }

    public long getSweepIntervalMs() { return sweepIntervalMs; }
    public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
}
