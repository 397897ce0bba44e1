package com.example.profile.client;

/** identity サービスが返す外部ユーザーの検証結果。 */
public record VerifiedIdentity(String externalUserId, String tenantId, boolean verified) {}
