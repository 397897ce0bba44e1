/*
 * どこで: Profile ドメインモデル
 * 何を: セッションの profile type と許可される遷移・付与項目を定義する
 * なぜ: profile type ごとに使う Repository と TTL を切り替えるため
 */
package com.example.profile.model;

import java.util.EnumSet;
import java.util.Set;

public enum ProfileType {
  UNAUTHENTICATED,
  LITE_GUEST,
  GUEST,
  AUTHENTICATED;

  public boolean canTransitionTo(ProfileType next) {
    return switch (this) {
      case UNAUTHENTICATED -> next == LITE_GUEST || next == GUEST || next == AUTHENTICATED;
      case LITE_GUEST -> next == GUEST || next == AUTHENTICATED;
      case GUEST -> next == AUTHENTICATED;
      // 認証済みは終端。同一セッション内で identity を外す遷移は存在しない
      case AUTHENTICATED -> false;
    };
  }

  /** decorated view の読み取りが可能か。LITE_GUEST は identity 射影のみ。 */
  public boolean canReadDecoratedProfile() {
    return this == GUEST || this == AUTHENTICATED;
  }

  public boolean canReadIdentity() {
    return this != UNAUTHENTICATED;
  }

  public Set<EnrichmentField> enrichments() {
    return switch (this) {
      case UNAUTHENTICATED, LITE_GUEST -> EnumSet.noneOf(EnrichmentField.class);
      case GUEST -> EnumSet.of(EnrichmentField.ADDRESS_DETAIL, EnrichmentField.SCHEDULED_DELIVERY);
      case AUTHENTICATED -> EnumSet.allOf(EnrichmentField.class);
    };
  }
}
