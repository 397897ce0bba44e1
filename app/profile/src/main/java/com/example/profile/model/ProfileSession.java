package com.example.profile.model;

import com.example.profile.error.ProfileException;

/**
 * リクエストに紐づく profile セッション。遷移は新しいインスタンスを返し、自身は変更しない。
 *
 * @param consumerId LITE_GUEST 以降で確定する consumer
 * @param externalUserId AUTHENTICATED で確定する外部ユーザー ID
 */
public record ProfileSession(
    String sessionId, ProfileType profileType, Long consumerId, String externalUserId) {

  public static ProfileSession unauthenticated(String sessionId) {
    return new ProfileSession(sessionId, ProfileType.UNAUTHENTICATED, null, null);
  }

  public ProfileSession toLiteGuest(long consumerId) {
    requireTransition(ProfileType.LITE_GUEST);
    return new ProfileSession(sessionId, ProfileType.LITE_GUEST, consumerId, null);
  }

  public ProfileSession toGuest(long consumerId) {
    requireTransition(ProfileType.GUEST);
    if (this.consumerId != null && this.consumerId != consumerId) {
      throw ProfileException.validation("guest upgrade must keep the session consumer");
    }
    return new ProfileSession(sessionId, ProfileType.GUEST, consumerId, null);
  }

  public ProfileSession toAuthenticated(long consumerId, String externalUserId) {
    if (profileType == ProfileType.AUTHENTICATED) {
      if (this.consumerId == consumerId && externalUserId.equals(this.externalUserId)) {
        return this;
      }
      throw ProfileException.validation("session is already authenticated");
    }
    requireTransition(ProfileType.AUTHENTICATED);
    if (this.consumerId != null && this.consumerId != consumerId) {
      throw ProfileException.validation("identity link must keep the session consumer");
    }
    return new ProfileSession(sessionId, ProfileType.AUTHENTICATED, consumerId, externalUserId);
  }

  public boolean owns(long consumerId) {
    return this.consumerId != null && this.consumerId == consumerId;
  }

  private void requireTransition(ProfileType next) {
    if (!profileType.canTransitionTo(next)) {
      throw ProfileException.validation(
          "profile type transition not allowed: " + profileType + " -> " + next);
    }
  }
}
