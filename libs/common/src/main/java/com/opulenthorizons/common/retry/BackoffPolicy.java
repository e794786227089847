/*
 * どこで: 共通リトライ補助
 * 何を: 指数バックオフ + ジッタの待機時間を計算する
 * なぜ: ストレージ/リモート API の一時障害リトライで同じ計算式を使うため
 */
package com.opulenthorizons.common.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public record BackoffPolicy(
    int maxAttempts,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration backoffMin) {

  public BackoffPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive");
    }
    backoffBase = backoffBase == null ? Duration.ofMillis(100) : backoffBase;
    backoffMax = backoffMax == null ? Duration.ofSeconds(5) : backoffMax;
    backoffExponentBase = backoffExponentBase <= 0 ? 2.0 : backoffExponentBase;
    if (backoffJitterMax < backoffJitterMin) {
      throw new IllegalArgumentException("backoffJitterMax must be >= backoffJitterMin");
    }
    backoffMin = backoffMin == null ? Duration.ZERO : backoffMin;
  }

  public static BackoffPolicy noDelay(int maxAttempts) {
    return new BackoffPolicy(
        maxAttempts, Duration.ZERO, Duration.ZERO, 2.0, 1.0, 1.0, Duration.ZERO);
  }

  /** attempt は 1 始まり。1 回目の失敗後の待機は backoffBase * jitter になる。 */
  public Duration delayFor(int attempt) {
    final double baseMillis = backoffBase.toMillis();
    final double exp = baseMillis * Math.pow(backoffExponentBase, (attempt - 1));
    final double capped = Math.min(exp, backoffMax.toMillis());
    final double jitter =
        backoffJitterMin
            + ThreadLocalRandom.current().nextDouble() * (backoffJitterMax - backoffJitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(backoffMin.toMillis(), backoffMillis));
  }

  public boolean hasAttemptsLeft(int attempt) {
    return attempt < maxAttempts;
  }
}
