/*
 * どこで: Profile サービス層
 * 何を: profile type に応じた読み取りと、住所・利用規約・外部 ID 連携などの業務ルールを提供する
 * なぜ: セッション状態ごとの許可判定を 1 か所に集め、キャッシュと Store の扱いを Repository に任せるため
 */
package com.example.profile.service;

import com.example.profile.client.EnrichmentUnavailableException;
import com.example.profile.client.IdentitySource;
import com.example.profile.client.VerifiedIdentity;
import com.example.profile.config.ProfileTermsProperties;
import com.example.profile.error.ProfileException;
import com.example.profile.model.AddressLink;
import com.example.profile.model.ConsumerIdentity;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ContactDetails;
import com.example.profile.model.DecoratedConsumerView;
import com.example.profile.model.ExperienceType;
import com.example.profile.model.ProfileSession;
import com.example.profile.model.ProfileType;
import com.example.profile.model.VipTier;
import com.example.profile.repository.AddressLinkRepository;
import com.example.profile.repository.ConsumerRepository;
import com.example.profile.repository.ScheduledDeliveryRepository;
import com.example.profile.repository.TermsOfServiceRepository;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConsumerProfileService {

  private static final Logger logger = LoggerFactory.getLogger(ConsumerProfileService.class);
  private static final String MDC_CONSUMER_ID = "consumer_id";

  private final ConsumerRepository consumerRepository;
  private final AddressLinkRepository addressLinkRepository;
  private final ScheduledDeliveryRepository scheduledDeliveryRepository;
  private final TermsOfServiceRepository termsOfServiceRepository;
  private final ConsumerDecorator decorator;
  private final IdentitySource identitySource;
  private final ProfileTermsProperties termsProperties;

  /** GUEST は住所と配達予定まで、AUTHENTICATED は全付与項目を返す。 */
  public DecoratedConsumerView getProfile(ProfileSession session, long consumerId) {
    if (!session.profileType().canReadDecoratedProfile()) {
      throw ProfileException.validation(
          "profile type " + session.profileType() + " cannot read the decorated profile");
    }
    requireOwner(session, consumerId);
    return withConsumer(consumerId, () -> decorator.decorate(consumerId, session.profileType()));
  }

  /** LITE_GUEST 以上。識別情報の射影のみを返す。 */
  public ConsumerIdentity getLiteProfile(ProfileSession session, long consumerId) {
    if (!session.profileType().canReadIdentity()) {
      throw ProfileException.validation("unauthenticated session cannot read profiles");
    }
    requireOwner(session, consumerId);
    return withConsumer(consumerId, () -> consumerRepository.getIdentity(consumerId));
  }

  /** 端末のみの guest。連絡先を持たない consumer を作成する。 */
  public ProfileSession createLiteGuest(ProfileSession session, ConsumerRecord draft) {
    if (!session.profileType().canTransitionTo(ProfileType.LITE_GUEST)) {
      throw ProfileException.validation(
          "profile type transition not allowed: " + session.profileType() + " -> LITE_GUEST");
    }
    final ConsumerRecord created =
        consumerRepository.create(
            ConsumerRecord.builder()
                .experienceType(draft.experienceType())
                .tenantId(draft.tenantId())
                .countryCode(draft.countryCode())
                .build());
    return session.toLiteGuest(created.consumerId());
  }

  /** UNAUTHENTICATED なら新規作成、LITE_GUEST なら既存 consumer に連絡先を登録して GUEST へ遷移する。 */
  public ProfileSession createGuest(ProfileSession session, ConsumerRecord draft) {
    if (!session.profileType().canTransitionTo(ProfileType.GUEST)) {
      throw ProfileException.validation(
          "profile type transition not allowed: " + session.profileType() + " -> GUEST");
    }
    if (session.consumerId() == null) {
      final ConsumerRecord created =
          consumerRepository.create(
              draft.toBuilder()
                  .consumerId(null)
                  .externalUserId(null)
                  .vipTier(null)
                  .defaultAddressId(null)
                  .build());
      return session.toGuest(created.consumerId());
    }
    final long consumerId = session.consumerId();
    withConsumer(
        consumerId,
        () ->
            consumerRepository.update(
                consumerId,
                current ->
                    current.toBuilder()
                        .firstName(draft.firstName())
                        .lastName(draft.lastName())
                        .email(draft.email())
                        .phoneNumber(draft.phoneNumber())
                        .countryCode(
                            draft.countryCode() == null
                                ? current.countryCode()
                                : draft.countryCode())
                        .build()));
    return session.toGuest(consumerId);
  }

  /**
   * identity サービスで検証済みの外部ユーザー ID を consumer に紐付け、AUTHENTICATED へ遷移する。
   *
   * <p>同じ外部 ID が別 consumer に紐付いていれば CONFLICT。
   */
  public ProfileSession linkIdentity(
      ProfileSession session, long consumerId, String externalUserId) {
    if (externalUserId == null || externalUserId.isBlank()) {
      throw ProfileException.validation("externalUserId is required");
    }
    requireOwner(session, consumerId);
    if (session.profileType() == ProfileType.AUTHENTICATED) {
      return session.toAuthenticated(consumerId, externalUserId);
    }
    final VerifiedIdentity identity = verify(externalUserId);
    withConsumer(
        consumerId,
        () ->
            consumerRepository.update(
                consumerId,
                current ->
                    current.toBuilder()
                        .externalUserId(identity.externalUserId())
                        .tenantId(
                            identity.tenantId() == null ? current.tenantId() : identity.tenantId())
                        .build()));
    logger.info("identity linked consumerId={}", consumerId);
    return session.toAuthenticated(consumerId, identity.externalUserId());
  }

  /** 既に外部 ID が紐付いた consumer でサインインする。 */
  public ProfileSession authenticate(
      ProfileSession session,
      String externalUserId,
      String tenantId,
      ExperienceType experienceType) {
    final VerifiedIdentity identity = verify(externalUserId);
    final ConsumerRecord consumer =
        consumerRepository.getByExternalUserId(identity.externalUserId(), tenantId, experienceType);
    return session.toAuthenticated(consumer.consumerId(), consumer.externalUserId());
  }

  public ConsumerRecord updateVipTier(long consumerId, VipTier vipTier) {
    return withConsumer(
        consumerId,
        () ->
            consumerRepository.update(
                consumerId, current -> current.toBuilder().vipTier(vipTier).build()));
  }

  public ConsumerRecord updateContact(long consumerId, ContactDetails contact) {
    if (contact == null) {
      throw ProfileException.validation("contact is required");
    }
    return withConsumer(
        consumerId,
        () ->
            consumerRepository.update(
                consumerId,
                current ->
                    current.toBuilder()
                        .firstName(contact.firstName())
                        .lastName(contact.lastName())
                        .email(contact.email())
                        .phoneNumber(contact.phoneNumber())
                        .build()));
  }

  public AddressLink addAddress(
      long consumerId, String geoAddressId, String label, boolean makeDefault) {
    requireGeoAddressId(geoAddressId);
    return withConsumer(
        consumerId,
        () -> {
          final AddressLink link = addressLinkRepository.link(consumerId, geoAddressId, label);
          if (makeDefault) {
            changeDefaultAddress(consumerId, geoAddressId);
          }
          return link;
        });
  }

  /** 紐付け済みの住所のみ既定にできる。判定は consumer 行のロック下で行う。 */
  public ConsumerRecord setDefaultAddress(long consumerId, String geoAddressId) {
    requireGeoAddressId(geoAddressId);
    return withConsumer(consumerId, () -> changeDefaultAddress(consumerId, geoAddressId));
  }

  /** 既定住所は削除できない。先に別の住所を既定にする。 */
  public void removeAddress(long consumerId, String geoAddressId) {
    requireGeoAddressId(geoAddressId);
    withConsumer(
        consumerId,
        () -> {
          addressLinkRepository.unlink(consumerId, geoAddressId);
          return null;
        });
  }

  public List<AddressLink> listAddresses(long consumerId) {
    return withConsumer(
        consumerId,
        () -> {
          consumerRepository.get(consumerId);
          return addressLinkRepository.list(consumerId);
        });
  }

  /** 現行バージョン以外への同意は VALIDATION_ERROR。 */
  public void acceptTermsOfService(long consumerId, int version) {
    if (version != termsProperties.currentVersion()) {
      throw ProfileException.validation(
          "only the current terms of service version can be accepted: "
              + termsProperties.currentVersion());
    }
    withConsumer(
        consumerId,
        () -> {
          termsOfServiceRepository.accept(consumerId, version);
          return null;
        });
  }

  public void deleteConsumer(long consumerId) {
    withConsumer(
        consumerId,
        () -> {
          consumerRepository.delete(consumerId);
          return null;
        });
  }

  private ConsumerRecord changeDefaultAddress(long consumerId, String geoAddressId) {
    final ConsumerRecord updated =
        consumerRepository.update(
            consumerId,
            current -> {
              addressLinkRepository.requireLinked(consumerId, geoAddressId);
              return current.toBuilder().defaultAddressId(geoAddressId).build();
            });
    // 旧住所を内包した配達予定を明示的に落とす
    scheduledDeliveryRepository.invalidate(updated);
    return updated;
  }

  private VerifiedIdentity verify(String externalUserId) {
    final VerifiedIdentity identity;
    try {
      identity =
          identitySource
              .resolve(externalUserId)
              .orElseThrow(() -> ProfileException.notFound("external identity not found"));
    } catch (EnrichmentUnavailableException ex) {
      throw ProfileException.unavailable("identity verification unavailable", ex);
    }
    if (!identity.verified()) {
      throw ProfileException.validation("external identity is not verified");
    }
    return identity;
  }

  private void requireOwner(ProfileSession session, long consumerId) {
    if (!session.owns(consumerId)) {
      throw ProfileException.validation("session does not own consumer " + consumerId);
    }
  }

  private void requireGeoAddressId(String geoAddressId) {
    if (geoAddressId == null || geoAddressId.isBlank()) {
      throw ProfileException.validation("geoAddressId is required");
    }
  }

  private <T> T withConsumer(long consumerId, Supplier<T> action) {
    MDC.put(MDC_CONSUMER_ID, String.valueOf(consumerId));
    try {
      return action.get();
    } finally {
      MDC.remove(MDC_CONSUMER_ID);
    }
  }
}
