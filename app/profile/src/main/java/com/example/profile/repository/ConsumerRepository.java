/*
 * どこで: Profile Repository 層
 * 何を: consumer レコードの read-through 読み取りと、コミット後の無効化を伴う書き込みを提供する
 * なぜ: どのキー経由で読まれても、コミット済みの書き込みより古い値を TTL を超えて返さないため
 */
package com.example.profile.repository;

import com.example.common.TraceIds;
import com.example.common.event.ConsumerEventPayload;
import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.cache.KeyType;
import com.example.profile.error.ProfileException;
import com.example.profile.event.ConsumerEventPublisher;
import com.example.profile.model.ConsumerField;
import com.example.profile.model.ConsumerIdentity;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ExperienceType;
import com.example.profile.store.ConsumerStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * consumer の読み書き窓口。
 *
 * <p>読み取り: CONSUMER_READ のキャッシュを確認し、ミス時は Store から読んで全 CONSUMER_READ キーへ
 * 書いてから返す。書き込み: 行ロック付きでトランザクションを実行し、コミット後に書き込み前後の
 * キーを削除する。キャッシュへの再充填は行わない。
 *
 * <p>コミット前に Store を読んだ読み手が、無効化の後に古い値を書き戻す競合は許容する。
 * その古さは用途の TTL で上限が決まる。
 */
@Component
@RequiredArgsConstructor
public class ConsumerRepository {

  private static final Logger logger = LoggerFactory.getLogger(ConsumerRepository.class);

  private final ConsumerStore store;
  private final ReadThroughCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final StoreOperations storeOperations;
  private final ConsumerEventPublisher eventPublisher;
  private final Clock clock;

  public ConsumerRecord get(long consumerId) {
    final KeyDescriptor key =
        resolver.lookupKey(CacheUseCase.CONSUMER_READ, KeyType.BY_INTERNAL_ID, consumerId);
    return cache
        .getOrLoad(
            key,
            ConsumerRecord.class,
            () -> storeOperations.read("findById", () -> store.findById(consumerId)),
            record -> resolver.keysFor(CacheUseCase.CONSUMER_READ, record))
        .orElseThrow(() -> ProfileException.notFound("consumer not found: " + consumerId));
  }

  public ConsumerRecord getByExternalUserId(
      String externalUserId, String tenantId, ExperienceType experienceType) {
    if (isBlank(externalUserId) || isBlank(tenantId) || experienceType == null) {
      throw ProfileException.validation(
          "externalUserId, tenantId and experienceType are required");
    }
    final KeyDescriptor key =
        resolver.lookupKey(
            CacheUseCase.CONSUMER_READ,
            KeyType.BY_EXTERNAL_USER_ID,
            tenantId,
            experienceType,
            externalUserId);
    return cache
        .getOrLoad(
            key,
            ConsumerRecord.class,
            () ->
                storeOperations.read(
                    "findByExternalUserId",
                    () -> store.findByExternalUserId(externalUserId, tenantId, experienceType)),
            record -> resolver.keysFor(CacheUseCase.CONSUMER_READ, record))
        .orElseThrow(
            () -> ProfileException.notFound("consumer not found for external user id"));
  }

  public ConsumerIdentity getIdentity(long consumerId) {
    final KeyDescriptor key =
        resolver.lookupKey(
            CacheUseCase.IMMUTABLE_IDENTITY, KeyType.BY_IMMUTABLE_IDENTITY, consumerId);
    return cache
        .getOrLoad(
            key,
            ConsumerIdentity.class,
            () ->
                storeOperations
                    .read("findById", () -> store.findById(consumerId))
                    .map(ConsumerIdentity::from))
        .orElseThrow(() -> ProfileException.notFound("consumer not found: " + consumerId));
  }

  /** consumerId は Store が採番する。draft に id があれば VALIDATION_ERROR。 */
  public ConsumerRecord create(ConsumerRecord draft) {
    if (draft.isPersisted()) {
      throw ProfileException.validation("new consumer must not carry an id");
    }
    final Instant now = Instant.now(clock);
    final ConsumerRecord toInsert = draft.toBuilder().createdAt(now).updatedAt(now).build();
    final ConsumerRecord created =
        storeOperations.write(
            "insert", () -> store.transactionally(() -> store.insert(toInsert)));
    cache.invalidate(resolver.invalidationKeys(null, created));
    publish(
        ConsumerEventPublisher.TOPIC_CREATED,
        created,
        ConsumerField.changedBetween(null, created));
    logger.info("consumer created consumerId={}", created.consumerId());
    return created;
  }

  /**
   * id が null なら新規作成、それ以外は既存レコードの全項目を置き換える。
   *
   * <p>recycle 済みの id は CONFLICT、存在しない id は NOT_FOUND。
   */
  public ConsumerRecord save(ConsumerRecord consumer) {
    if (!consumer.isPersisted()) {
      return create(consumer);
    }
    return update(consumer.consumerId(), current -> consumer);
  }

  /** ロックした最新の行に mutation を適用する。consumerId と createdAt は変更できない。 */
  public ConsumerRecord update(long consumerId, UnaryOperator<ConsumerRecord> mutation) {
    final Instant now = Instant.now(clock);
    final Revision revision =
        storeOperations.write(
            "update",
            () ->
                store.transactionally(
                    () -> {
                      final ConsumerRecord before = lockForWrite(consumerId);
                      final ConsumerRecord toWrite =
                          mutation
                              .apply(before)
                              .toBuilder()
                              .consumerId(consumerId)
                              .createdAt(before.createdAt())
                              .updatedAt(now)
                              .build();
                      return new Revision(before, store.update(toWrite));
                    }));
    final ConsumerRecord before = revision.before();
    final ConsumerRecord after = revision.after();
    // コミット後にのみ無効化する。順序を逆にすると古い値が再充填され得る
    cache.invalidate(resolver.invalidationKeys(before, after));
    final Set<ConsumerField> changed = ConsumerField.changedBetween(before, after);
    publish(ConsumerEventPublisher.TOPIC_UPDATED, after, changed);
    logger.info("consumer updated consumerId={} changedFields={}", consumerId, changed);
    return after;
  }

  /** soft delete。id は recycle 済みとなり、以降の読み取りは NOT_FOUND、保存は CONFLICT になる。 */
  public void delete(long consumerId) {
    final Instant now = Instant.now(clock);
    final ConsumerRecord deleted =
        storeOperations.write(
            "softDelete",
            () ->
                store.transactionally(
                    () -> {
                      final ConsumerRecord current =
                          store
                              .findByIdForUpdate(consumerId)
                              .orElseThrow(
                                  () ->
                                      ProfileException.notFound(
                                          "consumer not found: " + consumerId));
                      store.softDelete(consumerId, now);
                      return current;
                    }));
    cache.invalidate(resolver.allKeys(deleted));
    publish(ConsumerEventPublisher.TOPIC_DELETED, deleted, Set.of());
    logger.info("consumer deleted consumerId={}", consumerId);
  }

  /**
   * consumer 行をロックしたまま、consumer に従属するテーブルへの書き込みを同じトランザクションで行う。
   *
   * <p>work にはロック済みの最新行が渡る。キャッシュ上の値は参照しない。consumer 自体は変更しないため
   * 無効化もしない。recycle 済み・存在しない consumer は NOT_FOUND。
   */
  public <T> T withLockedConsumer(
      String operation, long consumerId, Function<ConsumerRecord, T> work) {
    return storeOperations.write(
        operation,
        () ->
            store.transactionally(
                () ->
                    work.apply(
                        store
                            .findByIdForUpdate(consumerId)
                            .orElseThrow(
                                () ->
                                    ProfileException.notFound(
                                        "consumer not found: " + consumerId)))));
  }

  private ConsumerRecord lockForWrite(long consumerId) {
    return store
        .findByIdForUpdate(consumerId)
        .orElseThrow(
            () ->
                store.isRecycled(consumerId)
                    ? ProfileException.conflict("consumer id is recycled: " + consumerId, null)
                    : ProfileException.notFound("consumer not found: " + consumerId));
  }

  private void publish(String topic, ConsumerRecord consumer, Collection<ConsumerField> changed) {
    final ConsumerEventPayload payload =
        new ConsumerEventPayload(
            UUID.randomUUID().toString(),
            topic,
            Instant.now(clock).toString(),
            consumer.consumerId(),
            consumer.externalUserId(),
            consumer.tenantId(),
            changed.stream().map(field -> field.name().toLowerCase(Locale.ROOT)).toList(),
            TraceIds.currentOrNew());
    eventPublisher.publish(topic, payload);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record Revision(ConsumerRecord before, ConsumerRecord after) {}
}
