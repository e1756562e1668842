package com.example.admission;

/**
 * バケツ状態の読み取り専用コピー。テストや診断用で、ストア内部の状態には触れない。
 * lastRefillNanos は単調時計 (System.nanoTime 相当) の値で、差分にだけ意味がある。
 */
public record BucketSnapshot(int tokens, long lastRefillNanos) {}
