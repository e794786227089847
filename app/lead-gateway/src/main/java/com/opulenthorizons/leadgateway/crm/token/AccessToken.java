/*
 * どこで: Lead Gateway トークン管理
 * 何を: メモリ上に保持するアクセストークンと有効期限、先行更新を始める時刻
 * なぜ: 期限判定と無効化をスレッド間で不変値として受け渡すため
 */
package com.opulenthorizons.leadgateway.crm.token;

import java.time.Duration;
import java.time.Instant;

public record AccessToken(String value, Instant expiresAt, Instant refreshAt, boolean invalidated) {

  public AccessToken {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("access token value is required");
    }
    if (expiresAt == null) {
      throw new IllegalArgumentException("expiresAt is required");
    }
    if (refreshAt == null || refreshAt.isAfter(expiresAt)) {
      refreshAt = expiresAt;
    }
  }

  /**
   * 発行直後のトークンを作る。
   *
   * <p>安全マージンは寿命の半分を上限とする。寿命がマージン以下でも、発行直後のトークンは先行更新の対象にならない。
   */
  public static AccessToken issued(
      String value, Instant issuedAt, Duration lifetime, Duration safetyMargin) {
    final Duration halfLifetime = lifetime.dividedBy(2);
    final Duration margin = safetyMargin.compareTo(halfLifetime) > 0 ? halfLifetime : safetyMargin;
    final Instant expiresAt = issuedAt.plus(lifetime);
    return new AccessToken(value, expiresAt, expiresAt.minus(margin), false);
  }

  public AccessToken invalidate() {
    return invalidated ? this : new AccessToken(value, expiresAt, refreshAt, true);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  /** 先行更新の時刻より前で、無効化されていない。 */
  public boolean isFresh(Instant now) {
    return !invalidated && now.isBefore(refreshAt);
  }

  /** 返却はできるが、裏で更新を始めるべき状態。 */
  public boolean isUsable(Instant now) {
    return !invalidated && !isExpired(now);
  }

  @Override
  public String toString() {
    // トークン値をログに出さない
    return "AccessToken[expiresAt="
        + expiresAt
        + ", refreshAt="
        + refreshAt
        + ", invalidated="
        + invalidated
        + "]";
  }
}
