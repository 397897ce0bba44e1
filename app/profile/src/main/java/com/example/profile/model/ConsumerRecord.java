/*
 * どこで: app/profile/src/main/java/com/example/profile/model/ConsumerRecord.java
 * 何を: consumers テーブル相当のドメインレコード
 * なぜ: Store/Cache/Service 間で同じ形の consumer を受け渡すため
 */
package com.example.profile.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import lombok.Builder;

/**
 * 永続化された consumer。consumerId は Store の採番で確定し、再利用されない。
 *
 * <p>(externalUserId, tenantId, experienceType) は 3 つとも非 null のとき一意。
 */
@Builder(toBuilder = true)
public record ConsumerRecord(
    Long consumerId,
    String externalUserId,
    ExperienceType experienceType,
    String tenantId,
    String defaultAddressId,
    String countryCode,
    VipTier vipTier,
    String paymentCustomerId,
    String firstName,
    String lastName,
    String email,
    String phoneNumber,
    Instant createdAt,
    Instant updatedAt) {

  @JsonIgnore
  public boolean isPersisted() {
    return consumerId != null;
  }

  public boolean hasExternalIdentity() {
    return externalUserId != null && tenantId != null && experienceType != null;
  }
}
