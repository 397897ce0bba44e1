package com.example.profile.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.profile.error.ErrorCode;
import com.example.profile.error.ProfileException;
import org.junit.jupiter.api.Test;

class ProfileSessionTest {

  @Test
  void unauthenticatedCanReachEveryOtherState() {
    final ProfileSession session = ProfileSession.unauthenticated("s-1");

    assertThat(session.toLiteGuest(1).profileType()).isEqualTo(ProfileType.LITE_GUEST);
    assertThat(session.toGuest(1).profileType()).isEqualTo(ProfileType.GUEST);
    assertThat(session.toAuthenticated(1, "ext-1").profileType())
        .isEqualTo(ProfileType.AUTHENTICATED);
  }

  @Test
  void liteGuestUpgradesKeepTheSameConsumer() {
    final ProfileSession lite = ProfileSession.unauthenticated("s-1").toLiteGuest(1);

    final ProfileSession guest = lite.toGuest(1);

    assertThat(guest.consumerId()).isEqualTo(1L);
    assertThat(guest.sessionId()).isEqualTo("s-1");
    assertValidationError(() -> lite.toGuest(2));
  }

  @Test
  void authenticatedIsTerminal() {
    final ProfileSession authenticated =
        ProfileSession.unauthenticated("s-1").toGuest(1).toAuthenticated(1, "ext-1");

    assertValidationError(() -> authenticated.toGuest(1));
    assertValidationError(() -> authenticated.toLiteGuest(1));
    assertValidationError(() -> authenticated.toAuthenticated(1, "ext-other"));
    assertThat(authenticated.toAuthenticated(1, "ext-1")).isSameAs(authenticated);
  }

  @Test
  void guestCannotDowngrade() {
    final ProfileSession guest = ProfileSession.unauthenticated("s-1").toGuest(1);

    assertValidationError(() -> guest.toLiteGuest(1));
    assertValidationError(() -> guest.toGuest(1));
  }

  @Test
  void enrichmentsDependOnProfileType() {
    assertThat(ProfileType.LITE_GUEST.enrichments()).isEmpty();
    assertThat(ProfileType.GUEST.enrichments())
        .containsExactlyInAnyOrder(
            EnrichmentField.ADDRESS_DETAIL, EnrichmentField.SCHEDULED_DELIVERY);
    assertThat(ProfileType.AUTHENTICATED.enrichments()).hasSize(4);
    assertThat(ProfileType.UNAUTHENTICATED.canReadIdentity()).isFalse();
    assertThat(ProfileType.LITE_GUEST.canReadDecoratedProfile()).isFalse();
  }

  private void assertValidationError(Runnable call) {
    assertThatThrownBy(call::run)
        .isInstanceOf(ProfileException.class)
        .extracting(ex -> ((ProfileException) ex).code())
        .isEqualTo(ErrorCode.VALIDATION_ERROR);
  }
}
