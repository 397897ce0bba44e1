/*
 * どこで: Profile ドメインモデル
 * 何を: consumer 本体と任意の付与情報をまとめた読み取り専用ビュー
 * なぜ: 付与情報は個別にキャッシュし、ビュー自体は毎回組み立てるため
 */
package com.example.profile.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

public record DecoratedConsumerView(
    ConsumerRecord consumer,
    ProfileType profileType,
    Optional<AddressDetail> addressDetail,
    Optional<Instant> scheduledDeliveryAt,
    Optional<TermsOfServiceStatus> termsOfService,
    Set<String> blockedItemTypes,
    Set<EnrichmentField> degradedFields) {

  public DecoratedConsumerView {
    if (consumer == null) {
      throw new IllegalArgumentException("consumer is required");
    }
    addressDetail = addressDetail == null ? Optional.empty() : addressDetail;
    scheduledDeliveryAt = scheduledDeliveryAt == null ? Optional.empty() : scheduledDeliveryAt;
    termsOfService = termsOfService == null ? Optional.empty() : termsOfService;
    blockedItemTypes = blockedItemTypes == null ? Set.of() : Set.copyOf(blockedItemTypes);
    degradedFields =
        degradedFields == null || degradedFields.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(degradedFields));
  }

  public boolean isDegraded() {
    return !degradedFields.isEmpty();
  }
}
