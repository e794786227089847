/*
 * どこで: Lead Gateway サービス層
 * 何を: 1 試行 = 1 トランザクションで処理を実行し、一時障害を再試行する。コミット後の通知は接続を返してから行う
 * なぜ: 接続断や直列化失敗で取り込みを落とさず、上限到達時は明示的な例外で返すため
 */
package com.opulenthorizons.leadgateway.service;

import com.opulenthorizons.common.retry.BackoffPolicy;
import com.opulenthorizons.common.retry.Sleeper;
import com.opulenthorizons.leadgateway.config.RetryProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class StorageTransactions {

  private static final Logger logger = LoggerFactory.getLogger(StorageTransactions.class);

  private final TransactionTemplate transactionTemplate;
  // 最も外側の execute の間だけ設定される
  private final ThreadLocal<List<Runnable>> afterRelease = new ThreadLocal<>();
  private final BackoffPolicy backoffPolicy;
  private final Sleeper sleeper;

  public StorageTransactions(
      TransactionTemplate transactionTemplate, RetryProperties retryProperties, Sleeper sleeper) {
    this.transactionTemplate = transactionTemplate;
    this.backoffPolicy = retryProperties.storage().toBackoffPolicy();
    this.sleeper = sleeper;
  }

  public <T> T execute(String operation, Supplier<T> work) {
    if (afterRelease.get() != null
        || TransactionSynchronizationManager.isActualTransactionActive()) {
      // 外側のトランザクションに参加する。再試行は外側の呼び出しに任せる
      return work.get();
    }
    final List<Runnable> pending = new ArrayList<>();
    afterRelease.set(pending);
    final T result;
    try {
      result = executeWithRetry(operation, work, pending);
    } finally {
      afterRelease.remove();
    }
    for (Runnable action : pending) {
      runQuietly(operation, action);
    }
    return result;
  }

  /**
   * コミット後、接続をプールに返してから action を実行する。
   *
   * <p>ロールバックされた試行で登録された action は実行しない。
   * トランザクション外なら即時に実行する。
   */
  public void runAfterRelease(Runnable action) {
    final List<Runnable> pending = afterRelease.get();
    if (pending != null) {
      pending.add(action);
      return;
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      action.run();
      return;
    }
    // このクラスを経由せずに始まったトランザクション。コミット後まで遅らせる
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCommit() {
            action.run();
          }
        });
  }

  private <T> T executeWithRetry(String operation, Supplier<T> work, List<Runnable> pending) {
    int attempt = 1;
    while (true) {
      try {
        return transactionTemplate.execute(status -> work.get());
      } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
        pending.clear();
        if (!backoffPolicy.hasAttemptsLeft(attempt)) {
          logger.warn("storage {} failed after attempts={}", operation, attempt, ex);
          throw new TransientStorageException("storage " + operation + " failed", ex);
        }
        final Duration delay = backoffPolicy.delayFor(attempt);
        logger.warn(
            "storage {} failed transiently attempt={} retryIn={}", operation, attempt, delay, ex);
        pause(operation, delay, ex);
        attempt++;
      }
    }
  }

  private void runQuietly(String operation, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException ex) {
      // コミット済みの結果は呼び出し元へ返す
      logger.warn("post-commit action failed after storage {}", operation, ex);
    }
  }

  private void pause(String operation, Duration delay, DataAccessException cause) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TransientStorageException("interrupted while retrying storage " + operation, cause);
    }
  }
}
