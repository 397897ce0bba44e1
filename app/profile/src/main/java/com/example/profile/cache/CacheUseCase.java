/*
 * どこで: Profile キャッシュ層
 * 何を: キャッシュ用途ごとのキー名前空間と、値が内包する consumer 項目を定義する
 * なぜ: 用途ごとに TTL と無効化粒度を分け、他用途のエントリを巻き込まないため
 */
package com.example.profile.cache;

import com.example.profile.model.ConsumerField;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum CacheUseCase {
  CONSUMER_READ("consumer", EnumSet.allOf(ConsumerField.class)),
  IMMUTABLE_IDENTITY(
      "identity",
      EnumSet.of(
          ConsumerField.CONSUMER_ID,
          ConsumerField.EXTERNAL_USER_ID,
          ConsumerField.TENANT_ID,
          ConsumerField.EXPERIENCE_TYPE,
          ConsumerField.VIP_TIER)),
  ADDRESS_DETAIL("address", EnumSet.noneOf(ConsumerField.class)),
  SCHEDULED_DELIVERY("delivery", EnumSet.of(ConsumerField.DEFAULT_ADDRESS_ID)),
  TERMS_OF_SERVICE("tos", EnumSet.noneOf(ConsumerField.class)),
  BLOCKED_ITEM_POLICY(
      "blocked",
      EnumSet.of(
          ConsumerField.EXPERIENCE_TYPE, ConsumerField.TENANT_ID, ConsumerField.COUNTRY_CODE));

  private final String namespace;
  private final EnumSet<ConsumerField> embeddedFields;

  CacheUseCase(String namespace, EnumSet<ConsumerField> embeddedFields) {
    this.namespace = namespace;
    this.embeddedFields = embeddedFields;
  }

  public String namespace() {
    return namespace;
  }

  /** キャッシュ値の中身が依存する consumer 項目。キー入力とは別に無効化判定へ使う。 */
  public Set<ConsumerField> embeddedFields() {
    return EnumSet.copyOf(embeddedFields);
  }

  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
