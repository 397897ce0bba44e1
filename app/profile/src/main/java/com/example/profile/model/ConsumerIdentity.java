package com.example.profile.model;

/** IMMUTABLE_IDENTITY 用の射影。vipTier を内包するため VIP 変更時も無効化対象になる。 */
public record ConsumerIdentity(
    long consumerId,
    String externalUserId,
    String tenantId,
    ExperienceType experienceType,
    VipTier vipTier) {

  public static ConsumerIdentity from(ConsumerRecord record) {
    return new ConsumerIdentity(
        record.consumerId(),
        record.externalUserId(),
        record.tenantId(),
        record.experienceType(),
        record.vipTier());
  }
}
