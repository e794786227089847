/*
 * どこで: Lead Gateway 設定バインド
 * 何を: ストレージ/リモート API 一時障害のリトライ設定を保持する
 * なぜ: バックオフ上限と試行回数を運用で調整するため
 */
package com.opulenthorizons.leadgateway.config;

import com.opulenthorizons.common.retry.BackoffPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lead-gateway.retry")
public record RetryProperties(Policy storage, Policy remote) {

  public RetryProperties {
    storage = storage == null ? Policy.defaults() : storage;
    remote = remote == null ? Policy.defaults() : remote;
  }

  public record Policy(
      int maxAttempts,
      Duration backoffBase,
      Duration backoffMax,
      double backoffExponentBase,
      double backoffJitterMin,
      double backoffJitterMax,
      Duration backoffMin) {

    public Policy {
      maxAttempts = maxAttempts <= 0 ? 3 : maxAttempts;
      backoffBase = backoffBase == null ? Duration.ofMillis(200) : backoffBase;
      backoffMax = backoffMax == null ? Duration.ofSeconds(5) : backoffMax;
      backoffExponentBase = backoffExponentBase <= 0 ? 2.0 : backoffExponentBase;
      if (backoffJitterMin <= 0 && backoffJitterMax <= 0) {
        backoffJitterMin = 0.8;
        backoffJitterMax = 1.2;
      }
      backoffMin = backoffMin == null ? Duration.ofMillis(50) : backoffMin;
    }

    static Policy defaults() {
      return new Policy(0, null, null, 0, 0, 0, null);
    }

    public BackoffPolicy toBackoffPolicy() {
      return new BackoffPolicy(
          maxAttempts,
          backoffBase,
          backoffMax,
          backoffExponentBase,
          backoffJitterMin,
          backoffJitterMax,
          backoffMin);
    }
  }
}
