package com.example.profile.store;

import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ExperienceType;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * consumer の正本。id 単位で少なくとも read committed の分離を提供する。
 *
 * <p>失敗は Spring の {@link org.springframework.dao.DataAccessException} 階層で通知する。
 */
public interface ConsumerStore {

  /** recycle 済みの consumer は返さない。 */
  Optional<ConsumerRecord> findById(long consumerId);

  Optional<ConsumerRecord> findByExternalUserId(
      String externalUserId, String tenantId, ExperienceType experienceType);

  /** トランザクション内で行ロックを取得して読む。recycle 済みは返さない。 */
  Optional<ConsumerRecord> findByIdForUpdate(long consumerId);

  boolean isRecycled(long consumerId);

  /** consumerId は Store が採番する。引数の consumerId は無視される。 */
  ConsumerRecord insert(ConsumerRecord consumer);

  ConsumerRecord update(ConsumerRecord consumer);

  boolean softDelete(long consumerId, Instant recycledAt);

  /** fn を 1 トランザクションで実行し、コミット後に結果を返す。実行時例外ではロールバックする。 */
  <T> T transactionally(Supplier<T> fn);
}
