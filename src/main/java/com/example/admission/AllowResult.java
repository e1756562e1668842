package com.example.admission;

/**
 * 1回の allow 判定結果。
 * remaining: 判定後に残っている整数トークン数
 * retryAfterSeconds: 拒否時、次の1トークンが補充されるまでの秒数 (許可時は0)
 */
public record AllowResult(boolean allowed, long remaining, long retryAfterSeconds) {}
