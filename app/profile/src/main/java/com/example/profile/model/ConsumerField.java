/*
 * どこで: Profile ドメインモデル
 * 何を: キャッシュキーやキャッシュ値が参照する consumer の項目を列挙する
 * なぜ: 書き込み時にどの use case を無効化すべきか差分から判定するため
 */
package com.example.profile.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

public enum ConsumerField {
  CONSUMER_ID(ConsumerRecord::consumerId),
  EXTERNAL_USER_ID(ConsumerRecord::externalUserId),
  EXPERIENCE_TYPE(ConsumerRecord::experienceType),
  TENANT_ID(ConsumerRecord::tenantId),
  DEFAULT_ADDRESS_ID(ConsumerRecord::defaultAddressId),
  COUNTRY_CODE(ConsumerRecord::countryCode),
  VIP_TIER(ConsumerRecord::vipTier),
  PAYMENT_CUSTOMER_ID(ConsumerRecord::paymentCustomerId),
  CONTACT(
      record ->
          List.of(
              Objects.toString(record.firstName(), ""),
              Objects.toString(record.lastName(), ""),
              Objects.toString(record.email(), ""),
              Objects.toString(record.phoneNumber(), "")));

  private final Function<ConsumerRecord, Object> accessor;

  ConsumerField(Function<ConsumerRecord, Object> accessor) {
    this.accessor = accessor;
  }

  public Object valueOf(ConsumerRecord record) {
    return accessor.apply(record);
  }

  /** before が null (新規作成) の場合は全項目が変化したものとして扱う。 */
  public static Set<ConsumerField> changedBetween(ConsumerRecord before, ConsumerRecord after) {
    if (before == null || after == null) {
      return EnumSet.allOf(ConsumerField.class);
    }
    final Set<ConsumerField> changed = EnumSet.noneOf(ConsumerField.class);
    for (ConsumerField field : values()) {
      if (!Objects.equals(field.valueOf(before), field.valueOf(after))) {
        changed.add(field);
      }
    }
    return changed;
  }
}
