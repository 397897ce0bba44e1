/*
 * どこで: Profile Repository 層
 * 何を: 利用規約の同意状態を read-through で返し、同意記録後に無効化する
 * なぜ: 同意状態は専用テーブルが正本で、consumer レコードの更新とは独立して変化するため
 */
package com.example.profile.repository;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.config.ProfileTermsProperties;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.TermsOfServiceStatus;
import com.example.profile.store.TermsOfServiceStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TermsOfServiceRepository {

  private static final Logger logger = LoggerFactory.getLogger(TermsOfServiceRepository.class);

  private final ReadThroughCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final TermsOfServiceStore store;
  private final ConsumerRepository consumerRepository;
  private final StoreOperations storeOperations;
  private final ProfileTermsProperties termsProperties;
  private final Clock clock;

  /** 読み取りは同意状態を変更しない。acceptedLatest は現行バージョンに対して毎回判定し直す。 */
  public TermsOfServiceStatus find(ConsumerRecord consumer) {
    final int currentVersion = termsProperties.currentVersion();
    final TermsOfServiceStatus cached =
        cache
            .getOrLoad(
                keyOf(consumer),
                TermsOfServiceStatus.class,
                () ->
                    Optional.of(
                        TermsOfServiceStatus.of(
                            storeOperations
                                .read(
                                    "findLatestAcceptedVersion",
                                    () -> store.findLatestAcceptedVersion(consumer.consumerId()))
                                .orElse(null),
                            currentVersion)))
            .orElseThrow();
    return TermsOfServiceStatus.of(cached.latestAcceptedVersion(), currentVersion);
  }

  /** consumer 行をロックして存在を確かめてから記録する。削除済みの consumer は NOT_FOUND。 */
  public void accept(long consumerId, int version) {
    final Instant now = Instant.now(clock);
    final ConsumerRecord consumer =
        consumerRepository.withLockedConsumer(
            "recordAcceptance",
            consumerId,
            locked -> {
              store.recordAcceptance(consumerId, version, now);
              return locked;
            });
    cache.invalidate(resolver.keysFor(CacheUseCase.TERMS_OF_SERVICE, consumer));
    logger.info("terms of service accepted consumerId={} version={}", consumerId, version);
  }

  private KeyDescriptor keyOf(ConsumerRecord consumer) {
    return resolver.keysFor(CacheUseCase.TERMS_OF_SERVICE, consumer).iterator().next();
  }
}
