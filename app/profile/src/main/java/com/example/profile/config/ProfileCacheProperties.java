/*
 * どこで: Profile アプリの設定バインド
 * 何を: キャッシュ用途ごとの TTL を保持する
 * なぜ: 識別情報と配達予定など鮮度要件の違う値を別々の TTL で運用するため
 */
package com.example.profile.config;

import com.example.profile.cache.CacheUseCase;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.cache")
public record ProfileCacheProperties(
    Duration consumerReadTtl,
    Duration identityTtl,
    Duration addressDetailTtl,
    Duration scheduledDeliveryTtl,
    Duration termsOfServiceTtl,
    Duration blockedItemPolicyTtl) {

  public ProfileCacheProperties {
    consumerReadTtl = positiveOrDefault(consumerReadTtl, Duration.ofMinutes(5));
    identityTtl = positiveOrDefault(identityTtl, Duration.ofMinutes(2));
    addressDetailTtl = positiveOrDefault(addressDetailTtl, Duration.ofMinutes(30));
    scheduledDeliveryTtl = positiveOrDefault(scheduledDeliveryTtl, Duration.ofSeconds(30));
    termsOfServiceTtl = positiveOrDefault(termsOfServiceTtl, Duration.ofMinutes(10));
    blockedItemPolicyTtl = positiveOrDefault(blockedItemPolicyTtl, Duration.ofMinutes(10));
  }

  public static ProfileCacheProperties defaults() {
    return new ProfileCacheProperties(null, null, null, null, null, null);
  }

  public Duration ttlFor(CacheUseCase useCase) {
    return switch (useCase) {
      case CONSUMER_READ -> consumerReadTtl;
      case IMMUTABLE_IDENTITY -> identityTtl;
      case ADDRESS_DETAIL -> addressDetailTtl;
      case SCHEDULED_DELIVERY -> scheduledDeliveryTtl;
      case TERMS_OF_SERVICE -> termsOfServiceTtl;
      case BLOCKED_ITEM_POLICY -> blockedItemPolicyTtl;
    };
  }

  private static Duration positiveOrDefault(Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
