/*
 * どこで: Profile Repository 層
 * 何を: Store 呼び出しの失敗をリトライし、エラーコードへ変換する
 * なぜ: 必須依存である Store の一時障害を上限付きで吸収し、書き込み失敗を一貫して分類するため
 */
package com.example.profile.repository;

import com.example.profile.config.ProfileStoreProperties;
import com.example.profile.error.ProfileException;
import com.example.profile.service.ProfileMetrics;
import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

@Component
public class StoreOperations {

  private static final Logger logger = LoggerFactory.getLogger(StoreOperations.class);

  private final ProfileStoreProperties properties;
  private final ProfileMetrics metrics;
  private final Sleeper sleeper;

  @Autowired
  public StoreOperations(ProfileStoreProperties properties, ProfileMetrics metrics) {
    this(properties, metrics, duration -> Thread.sleep(duration.toMillis()));
  }

  @VisibleForTesting
  StoreOperations(ProfileStoreProperties properties, ProfileMetrics metrics, Sleeper sleeper) {
    this.properties = properties;
    this.metrics = metrics;
    this.sleeper = sleeper;
  }

  /**
   * 読み取りは冪等なので一時的な失敗 (transient / recoverable) のみ上限回数まで再試行し、尽きたら
   * UNAVAILABLE。SQL 不正などの恒久的な失敗は再試行せずに UNAVAILABLE。
   */
  public <T> T read(String operation, Supplier<T> reader) {
    int attempt = 1;
    while (true) {
      try {
        return reader.get();
      } catch (TransientDataAccessException | RecoverableDataAccessException ex) {
        if (attempt >= properties.readMaxAttempts()) {
          logger.warn("store read failed operation={} attempts={}", operation, attempt, ex);
          throw ProfileException.unavailable("store read failed: " + operation, ex);
        }
        metrics.recordStoreReadRetry();
        logger.debug("store read retry scheduled operation={} attempt={}", operation, attempt);
        sleepBeforeRetry(operation, attempt, ex);
        attempt++;
      } catch (DataAccessException ex) {
        logger.warn("store read failed without retry operation={}", operation, ex);
        throw ProfileException.unavailable("store read failed: " + operation, ex);
      }
    }
  }

  /**
   * 書き込みは再試行しない。一意制約違反は CONFLICT、NOT NULL や外部キーなど他の制約違反は呼び出し側の
   * 誤りとして VALIDATION_ERROR、それ以外は UNAVAILABLE。
   */
  public <T> T write(String operation, Supplier<T> writer) {
    try {
      return writer.get();
    } catch (DuplicateKeyException ex) {
      logger.info("store write rejected by unique constraint operation={}", operation);
      throw ProfileException.conflict("store write conflict: " + operation, ex);
    } catch (DataIntegrityViolationException ex) {
      logger.warn("store write rejected by integrity constraint operation={}", operation, ex);
      throw ProfileException.validation("store write rejected: " + operation, ex);
    } catch (DataAccessException ex) {
      logger.warn("store write failed operation={}", operation, ex);
      throw ProfileException.unavailable("store write failed: " + operation, ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.readBackoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2, attempt - 1);
    final double capped = Math.min(exp, properties.readBackoffMax().toMillis());
    return Duration.ofMillis((long) Math.ceil(capped));
  }

  private void sleepBeforeRetry(String operation, int attempt, DataAccessException cause) {
    try {
      sleeper.sleep(computeBackoffDuration(attempt));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      final ProfileException interrupted =
          ProfileException.unavailable("store read interrupted: " + operation, cause);
      interrupted.addSuppressed(ex);
      throw interrupted;
    }
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
