/*
 * どこで: Lead Gateway トークン管理
 * 何を: CRM アクセストークンのキャッシュ/更新/無効化を単一の状態機械として管理する
 * なぜ: 並行リクエストからの更新を 1 本にまとめ、ローテーションされたリフレッシュトークンを失わないため
 */
package com.opulenthorizons.leadgateway.crm.token;

import com.google.common.annotations.VisibleForTesting;
import com.opulenthorizons.common.retry.BackoffPolicy;
import com.opulenthorizons.common.retry.Sleeper;
import com.opulenthorizons.leadgateway.config.CrmApiProperties;
import com.opulenthorizons.leadgateway.config.CrmOAuthProperties;
import com.opulenthorizons.leadgateway.config.RetryProperties;
import com.opulenthorizons.leadgateway.crm.CrmNotConfiguredException;
import com.opulenthorizons.leadgateway.crm.TransientRemoteException;
import com.opulenthorizons.leadgateway.service.LeadGatewayMetrics;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class AccessTokenManager {

  private static final Logger logger = LoggerFactory.getLogger(AccessTokenManager.class);

  private final TokenEndpointClient tokenEndpointClient;
  private final RefreshTokenStore refreshTokenStore;
  private final CrmOAuthProperties properties;
  private final String remoteSystem;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;
  private final ExecutorService refreshExecutor;
  private final LeadGatewayMetrics metrics;
  private final Clock clock;

  private final AtomicReference<AccessToken> current = new AtomicReference<>();
  private final AtomicReference<String> refreshToken = new AtomicReference<>();
  private final ReentrantLock refreshLock = new ReentrantLock();
  // refreshLock で保護する。更新中でなければ null。
  private CompletableFuture<AccessToken> inFlight;
  private volatile boolean revoked;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ExecutorService と各クライアントは Spring 管理の共有コンポーネントのため")
  public AccessTokenManager(
      TokenEndpointClient tokenEndpointClient,
      RefreshTokenStore refreshTokenStore,
      CrmOAuthProperties properties,
      CrmApiProperties apiProperties,
      RetryProperties retryProperties,
      Sleeper sleeper,
      @Qualifier("crmTokenRefreshExecutor") ExecutorService refreshExecutor,
      LeadGatewayMetrics metrics,
      Clock clock) {
    this.tokenEndpointClient = tokenEndpointClient;
    this.refreshTokenStore = refreshTokenStore;
    this.properties = properties;
    this.remoteSystem = apiProperties.remoteSystem();
    this.backoffPolicy = retryProperties.remote().toBackoffPolicy();
    this.sleeper = sleeper;
    this.refreshExecutor = refreshExecutor;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** 有効なアクセストークンを返す。必要なら更新を待つ。 */
  public String getToken() {
    if (!properties.oauthConfigured()) {
      if (properties.staticTokenConfigured()) {
        return properties.staticAccessToken();
      }
      throw new CrmNotConfiguredException("CRM OAuth credentials are not configured");
    }
    if (revoked) {
      throw new CredentialExpiredException("refresh credential revoked; operator reset required");
    }
    final AccessToken cached = current.get();
    final Instant now = clock.instant();
    if (cached != null && cached.isUsable(now)) {
      if (!cached.isFresh(now)) {
        // 期限が近いだけなら手元のトークンを返しつつ裏で更新する
        startRefresh();
      }
      return cached.value();
    }
    return await(startRefresh()).value();
  }

  /** 次の {@link #getToken()} で必ず更新させる。 */
  public void invalidate() {
    current.updateAndGet(token -> token == null ? null : token.invalidate());
  }

  /** キャッシュ中のトークンが拒否されたトークンと同じ場合だけ無効化する。 */
  public void invalidate(String rejectedToken) {
    current.updateAndGet(
        token -> token != null && token.value().equals(rejectedToken) ? token.invalidate() : token);
  }

  /** 運用者が新しいリフレッシュトークンを投入して REVOKED から復帰させる。 */
  public void reset(String newRefreshToken) {
    if (newRefreshToken == null || newRefreshToken.isBlank()) {
      throw new IllegalArgumentException("refreshToken is required");
    }
    refreshTokenStore.save(remoteSystem, newRefreshToken.trim());
    refreshToken.set(newRefreshToken.trim());
    current.set(null);
    revoked = false;
    logger.info("crm refresh credential reset remoteSystem={}", remoteSystem);
  }

  public TokenState state() {
    if (!properties.oauthConfigured()) {
      return properties.staticTokenConfigured() ? TokenState.VALID : TokenState.UNLOADED;
    }
    if (revoked) {
      return TokenState.REVOKED;
    }
    refreshLock.lock();
    try {
      if (inFlight != null) {
        return TokenState.REFRESHING;
      }
    } finally {
      refreshLock.unlock();
    }
    final AccessToken cached = current.get();
    if (cached == null) {
      return TokenState.UNLOADED;
    }
    if (cached.invalidated()) {
      return TokenState.INVALIDATED;
    }
    return cached.isFresh(clock.instant())
        ? TokenState.VALID
        : TokenState.EXPIRING_SOON;
  }

  public Optional<Instant> expiresAt() {
    return Optional.ofNullable(current.get()).map(AccessToken::expiresAt);
  }

  private CompletableFuture<AccessToken> startRefresh() {
    refreshLock.lock();
    try {
      if (inFlight != null) {
        return inFlight;
      }
      // ロック待ちの間に他スレッドが更新を終えていれば、その結果を使う
      final AccessToken cached = current.get();
      if (cached != null && cached.isFresh(clock.instant())) {
        return CompletableFuture.completedFuture(cached);
      }
      final CompletableFuture<AccessToken> future = new CompletableFuture<>();
      inFlight = future;
      try {
        refreshExecutor.execute(() -> runRefresh(future));
      } catch (RejectedExecutionException ex) {
        inFlight = null;
        future.completeExceptionally(
            new TransientRemoteException("token refresh executor rejected task", ex));
      }
      return future;
    } finally {
      refreshLock.unlock();
    }
  }

  private void runRefresh(CompletableFuture<AccessToken> future) {
    try {
      final AccessToken refreshed = refreshWithRetry();
      current.set(refreshed);
      clearInFlight(future);
      future.complete(refreshed);
    } catch (RuntimeException ex) {
      logger.warn("crm token refresh failed remoteSystem={}", remoteSystem, ex);
      clearInFlight(future);
      future.completeExceptionally(ex);
    }
  }

  private void clearInFlight(CompletableFuture<AccessToken> future) {
    refreshLock.lock();
    try {
      if (inFlight == future) {
        inFlight = null;
      }
    } finally {
      refreshLock.unlock();
    }
  }

  @VisibleForTesting
  AccessToken refreshWithRetry() {
    final String credential = loadRefreshToken();
    int attempt = 1;
    while (true) {
      try {
        final TokenGrant grant = tokenEndpointClient.refresh(credential);
        if (grant.refreshToken() != null && !grant.refreshToken().equals(credential)) {
          // 新しいアクセストークンを公開する前にローテーション後の値を保存する
          refreshTokenStore.save(remoteSystem, grant.refreshToken());
          refreshToken.set(grant.refreshToken());
          logger.info("crm refresh token rotated remoteSystem={}", remoteSystem);
        }
        final Duration lifetime =
            grant.expiresIn() == null ? properties.defaultExpiresIn() : grant.expiresIn();
        final AccessToken token =
            AccessToken.issued(
                grant.accessToken(), clock.instant(), lifetime, properties.safetyMargin());
        metrics.recordTokenRefresh("success");
        logger.info(
            "crm access token refreshed remoteSystem={} expiresAt={}",
            remoteSystem,
            token.expiresAt());
        return token;
      } catch (CredentialExpiredException ex) {
        revoked = true;
        current.set(null);
        metrics.recordTokenRefresh("revoked");
        logger.error(
            "crm refresh credential rejected; operator reset required remoteSystem={}",
            remoteSystem,
            ex);
        throw ex;
      } catch (TransientRemoteException ex) {
        if (!backoffPolicy.hasAttemptsLeft(attempt)) {
          metrics.recordTokenRefresh("transient_failure");
          throw ex;
        }
        final Duration delay = backoffPolicy.delayFor(attempt);
        logger.warn(
            "crm token refresh failed transiently attempt={} retryIn={}", attempt, delay, ex);
        sleepQuietly(delay, ex);
        attempt++;
      }
    }
  }

  private String loadRefreshToken() {
    final String cached = refreshToken.get();
    if (cached != null) {
      return cached;
    }
    final String loaded =
        refreshTokenStore
            .find(remoteSystem)
            .filter(value -> !value.isBlank())
            .orElse(properties.refreshToken());
    if (loaded.isBlank()) {
      throw new CrmNotConfiguredException("CRM refresh token is not configured");
    }
    refreshToken.compareAndSet(null, loaded);
    return refreshToken.get();
  }

  private AccessToken await(CompletableFuture<AccessToken> future) {
    try {
      return future.get(properties.refreshTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("token refresh failed", ex.getCause());
    } catch (TimeoutException ex) {
      throw new TransientRemoteException("token refresh timed out", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TransientRemoteException("interrupted while waiting for token refresh", ex);
    }
  }

  private void sleepQuietly(Duration delay, TransientRemoteException cause) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      cause.addSuppressed(ex);
      throw cause;
    }
  }
}
