package com.example.profile.repository;

import static com.example.profile.support.ProfileTestFixtures.NOW;
import static com.example.profile.support.ProfileTestFixtures.consumer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.config.ProfileStoreProperties;
import com.example.profile.config.ProfileTermsProperties;
import com.example.profile.error.ErrorCode;
import com.example.profile.error.ProfileException;
import com.example.profile.event.ConsumerEventPublisher;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.TermsOfServiceStatus;
import com.example.profile.service.ProfileMetrics;
import com.example.profile.store.TermsOfServiceStore;
import com.example.profile.support.InMemoryConsumerCache;
import com.example.profile.support.InMemoryConsumerStore;
import com.example.profile.support.MutableClock;
import com.example.profile.support.ProfileTestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TermsOfServiceRepositoryTest {

  @Mock private TermsOfServiceStore store;
  @Mock private ConsumerEventPublisher eventPublisher;

  private MutableClock clock;
  private InMemoryConsumerCache cache;
  private ReadThroughCache readThroughCache;
  private ConsumerKeySpaceResolver resolver;
  private StoreOperations storeOperations;
  private ConsumerRepository consumerRepository;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    cache = new InMemoryConsumerCache(clock);
    resolver = new ConsumerKeySpaceResolver();
    final ProfileMetrics metrics = new ProfileMetrics(new SimpleMeterRegistry());
    readThroughCache = ProfileTestFixtures.readThroughCache(cache, resolver, metrics);
    storeOperations = new StoreOperations(new ProfileStoreProperties(1, null, null), metrics);
    final InMemoryConsumerStore consumerStore = new InMemoryConsumerStore();
    consumerStore.seed(consumer(42));
    consumerRepository =
        new ConsumerRepository(
            consumerStore, readThroughCache, resolver, storeOperations, eventPublisher, clock);
  }

  @Test
  void readsDoNotMutateAndAreCached() {
    when(store.findLatestAcceptedVersion(42)).thenReturn(Optional.of(2));
    final TermsOfServiceRepository repository = repository(3);

    final TermsOfServiceStatus first = repository.find(consumer(42));
    final TermsOfServiceStatus second = repository.find(consumer(42));

    assertThat(first).isEqualTo(new TermsOfServiceStatus(false, 2));
    assertThat(second).isEqualTo(first);
    verify(store, times(1)).findLatestAcceptedVersion(anyLong());
    assertThat(cache.liveKeys()).containsExactly("cp:tos:id:42");
  }

  @Test
  void acceptRecordsAndInvalidatesStatus() {
    when(store.findLatestAcceptedVersion(42)).thenReturn(Optional.empty(), Optional.of(3));
    final TermsOfServiceRepository repository = repository(3);
    assertThat(repository.find(consumer(42)).acceptedLatest()).isFalse();

    repository.accept(42, 3);

    verify(store).recordAcceptance(42, 3, NOW);
    assertThat(cache.deletedKeys()).containsExactly("cp:tos:id:42");
    assertThat(repository.find(consumer(42))).isEqualTo(new TermsOfServiceStatus(true, 3));
  }

  @Test
  void acceptForDeletedConsumerIsNotFoundEvenWhileCacheIsStale() {
    final ConsumerRecord stale = consumerRepository.get(42);
    consumerRepository.delete(42);
    readThroughCache.populate(resolver.keysFor(CacheUseCase.CONSUMER_READ, stale), stale);
    assertThat(consumerRepository.get(42)).isEqualTo(stale);

    assertThatThrownBy(() -> repository(3).accept(42, 3))
        .isInstanceOf(ProfileException.class)
        .extracting(ex -> ((ProfileException) ex).code())
        .isEqualTo(ErrorCode.NOT_FOUND);
    verify(store, never()).recordAcceptance(anyLong(), anyInt(), any());
  }

  @Test
  void cachedStatusIsReevaluatedAgainstCurrentVersion() {
    when(store.findLatestAcceptedVersion(42)).thenReturn(Optional.of(3));
    repository(3).find(consumer(42));

    final TermsOfServiceStatus afterVersionBump = repository(4).find(consumer(42));

    assertThat(afterVersionBump).isEqualTo(new TermsOfServiceStatus(false, 3));
    verify(store, times(1)).findLatestAcceptedVersion(anyLong());
  }

  private TermsOfServiceRepository repository(int currentVersion) {
    return new TermsOfServiceRepository(
        readThroughCache,
        resolver,
        store,
        consumerRepository,
        storeOperations,
        new ProfileTermsProperties(currentVersion),
        clock);
  }
}
