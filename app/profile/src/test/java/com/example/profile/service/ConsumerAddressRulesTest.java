/*
 * どこで: Profile サービス層テスト
 * 何を: 実 Repository とインメモリの Store/Cache で住所ルールを通しで検証する
 * なぜ: 既定住所は常に紐付け済みという不変条件が、古いキャッシュや削除直後でも崩れないことを保証するため
 */
package com.example.profile.service;

import static com.example.profile.support.ProfileTestFixtures.NOW;
import static com.example.profile.support.ProfileTestFixtures.consumer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.config.ProfileStoreProperties;
import com.example.profile.config.ProfileTermsProperties;
import com.example.profile.error.ErrorCode;
import com.example.profile.error.ProfileException;
import com.example.profile.event.ConsumerEventPublisher;
import com.example.profile.model.AddressLink;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.repository.AddressLinkRepository;
import com.example.profile.repository.ConsumerRepository;
import com.example.profile.repository.ReadThroughCache;
import com.example.profile.repository.ScheduledDeliveryRepository;
import com.example.profile.repository.StoreOperations;
import com.example.profile.repository.TermsOfServiceRepository;
import com.example.profile.store.TermsOfServiceStore;
import com.example.profile.support.InMemoryAddressLinkStore;
import com.example.profile.support.InMemoryConsumerCache;
import com.example.profile.support.InMemoryConsumerStore;
import com.example.profile.support.MutableClock;
import com.example.profile.support.ProfileTestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConsumerAddressRulesTest {

  @Mock private ConsumerEventPublisher eventPublisher;
  @Mock private ConsumerDecorator decorator;
  @Mock private TermsOfServiceStore termsOfServiceStore;

  private InMemoryConsumerStore consumerStore;
  private InMemoryAddressLinkStore linkStore;
  private ConsumerKeySpaceResolver resolver;
  private ReadThroughCache readThroughCache;
  private ConsumerRepository consumerRepository;
  private ConsumerProfileService service;

  @BeforeEach
  void setUp() {
    final MutableClock clock = new MutableClock(NOW);
    final ProfileMetrics metrics = new ProfileMetrics(new SimpleMeterRegistry());
    final StoreOperations storeOperations =
        new StoreOperations(new ProfileStoreProperties(1, null, null), metrics);
    final ProfileTermsProperties termsProperties = new ProfileTermsProperties(3);
    consumerStore = new InMemoryConsumerStore();
    linkStore = new InMemoryAddressLinkStore();
    resolver = new ConsumerKeySpaceResolver();
    readThroughCache =
        ProfileTestFixtures.readThroughCache(new InMemoryConsumerCache(clock), resolver, metrics);
    consumerRepository =
        new ConsumerRepository(
            consumerStore, readThroughCache, resolver, storeOperations, eventPublisher, clock);
    final AddressLinkRepository addressLinkRepository =
        new AddressLinkRepository(linkStore, consumerRepository, storeOperations, clock);
    service =
        new ConsumerProfileService(
            consumerRepository,
            addressLinkRepository,
            new ScheduledDeliveryRepository(
                readThroughCache, resolver, consumerId -> Optional.empty()),
            new TermsOfServiceRepository(
                readThroughCache,
                resolver,
                termsOfServiceStore,
                consumerRepository,
                storeOperations,
                termsProperties,
                clock),
            decorator,
            externalUserId -> Optional.empty(),
            termsProperties);

    consumerStore.seed(consumer(42));
    linkStore.insert(new AddressLink(42, "geo-42", "home", NOW));
  }

  @Test
  void newDefaultCannotBeRemovedWhileStaleRecordIsCached() {
    service.addAddress(42, "geo-new", "office", false);
    final ConsumerRecord beforeSwitch = consumerStore.findById(42).orElseThrow();

    service.setDefaultAddress(42, "geo-new");
    // 切り替え前に読んだ読み手が、無効化の後に古い値を書き戻す
    repopulate(beforeSwitch);
    assertThat(consumerRepository.get(42).defaultAddressId()).isEqualTo("geo-42");

    assertCode(() -> service.removeAddress(42, "geo-new"), ErrorCode.VALIDATION_ERROR);

    final String persistedDefault = consumerStore.findById(42).orElseThrow().defaultAddressId();
    assertThat(persistedDefault).isEqualTo("geo-new");
    assertThat(linkStore.exists(42, persistedDefault)).isTrue();
  }

  @Test
  void previousDefaultCanBeRemovedEvenIfStaleRecordStillNamesIt() {
    service.addAddress(42, "geo-new", "office", false);
    final ConsumerRecord beforeSwitch = consumerStore.findById(42).orElseThrow();
    service.setDefaultAddress(42, "geo-new");
    repopulate(beforeSwitch);

    service.removeAddress(42, "geo-42");

    assertThat(service.listAddresses(42))
        .extracting(AddressLink::geoAddressId)
        .containsExactly("geo-new");
  }

  @Test
  void unlinkedAddressCannotBecomeDefault() {
    assertCode(() -> service.setDefaultAddress(42, "geo-missing"), ErrorCode.VALIDATION_ERROR);

    assertThat(consumerStore.findById(42).orElseThrow().defaultAddressId()).isEqualTo("geo-42");
  }

  @Test
  void deletedConsumerCannotGainAddressesOrAcceptTermsWhileStaleRecordIsCached() {
    final ConsumerRecord beforeDelete = consumerRepository.get(42);
    service.deleteConsumer(42);
    repopulate(beforeDelete);

    assertCode(() -> service.addAddress(42, "geo-late", "late", false), ErrorCode.NOT_FOUND);
    assertCode(() -> service.acceptTermsOfService(42, 3), ErrorCode.NOT_FOUND);
    assertThat(linkStore.exists(42, "geo-late")).isFalse();
  }

  private void repopulate(ConsumerRecord stale) {
    readThroughCache.populate(resolver.keysFor(CacheUseCase.CONSUMER_READ, stale), stale);
  }

  private void assertCode(ThrowingCallable call, ErrorCode code) {
    assertThatThrownBy(call)
        .isInstanceOf(ProfileException.class)
        .extracting(ex -> ((ProfileException) ex).code())
        .isEqualTo(code);
  }
}
