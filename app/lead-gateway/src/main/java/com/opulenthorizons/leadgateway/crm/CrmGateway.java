/*
 * どこで: Lead Gateway CRM 連携
 * 何を: アクセストークンの付与と 401 時の 1 回だけの再試行、一時障害のバックオフ再試行を担う
 * なぜ: 同期処理からトークン管理とリトライ方針を切り離すため
 */
package com.opulenthorizons.leadgateway.crm;

import com.opulenthorizons.common.retry.BackoffPolicy;
import com.opulenthorizons.common.retry.Sleeper;
import com.opulenthorizons.leadgateway.config.RetryProperties;
import com.opulenthorizons.leadgateway.crm.token.AccessTokenManager;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CrmGateway {

  private static final Logger logger = LoggerFactory.getLogger(CrmGateway.class);

  private final CrmRecordClient recordClient;
  private final AccessTokenManager tokenManager;
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;

  public CrmGateway(
      CrmRecordClient recordClient,
      AccessTokenManager tokenManager,
      RetryProperties retryProperties,
      Sleeper sleeper) {
    this.recordClient = recordClient;
    this.tokenManager = tokenManager;
    this.backoffPolicy = retryProperties.remote().toBackoffPolicy();
    this.sleeper = sleeper;
  }

  public Optional<CrmLead> fetch(String recordId) {
    return withRetry("fetch", true, token -> recordClient.fetch(token, recordId));
  }

  public Optional<CrmLead> searchByEmail(String email) {
    return withRetry("searchByEmail", true, token -> recordClient.searchByEmail(token, email));
  }

  public Optional<CrmLead> searchByPhone(String phone) {
    return withRetry("searchByPhone", true, token -> recordClient.searchByPhone(token, phone));
  }

  /** 作成は応答を失った場合に重複しうるため一時障害でも再送しない。 */
  public CrmWriteResult create(CrmLeadWrite write) {
    return withRetry("create", false, token -> recordClient.create(token, write));
  }

  public CrmWriteResult update(String recordId, CrmLeadWrite write) {
    return withRetry("update", true, token -> recordClient.update(token, recordId, write));
  }

  private <T> T withRetry(String operation, boolean idempotent, Function<String, T> call) {
    int attempt = 1;
    while (true) {
      try {
        return withAuthorization(operation, call);
      } catch (TransientRemoteException ex) {
        if (!idempotent || !backoffPolicy.hasAttemptsLeft(attempt)) {
          throw ex;
        }
        final Duration delay = backoffPolicy.delayFor(attempt);
        logger.warn(
            "crm {} failed transiently attempt={} retryIn={}", operation, attempt, delay, ex);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          ex.addSuppressed(interrupted);
          throw ex;
        }
        attempt++;
      }
    }
  }

  private <T> T withAuthorization(String operation, Function<String, T> call) {
    final String token = tokenManager.getToken();
    try {
      return call.apply(token);
    } catch (CrmIntegrationException ex) {
      if (ex.reason() != CrmIntegrationException.Reason.UNAUTHORIZED) {
        throw ex;
      }
      // 401 は拒否されたトークンだけを無効化し、1 回だけ取り直して再送する
      logger.warn("crm {} rejected access token; refreshing once", operation);
      tokenManager.invalidate(token);
      return call.apply(tokenManager.getToken());
    }
  }
}
