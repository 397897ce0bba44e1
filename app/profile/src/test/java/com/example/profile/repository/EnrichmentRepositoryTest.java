package com.example.profile.repository;

import static com.example.profile.support.ProfileTestFixtures.NOW;
import static com.example.profile.support.ProfileTestFixtures.consumer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.client.EnrichmentUnavailableException;
import com.example.profile.model.AddressDetail;
import com.example.profile.model.BlockedItemPolicy;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ScheduledDelivery;
import com.example.profile.service.ProfileMetrics;
import com.example.profile.support.InMemoryConsumerCache;
import com.example.profile.support.MutableClock;
import com.example.profile.support.ProfileTestFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** 付与情報 Repository の read-through と TTL の検証。 */
class EnrichmentRepositoryTest {

  private static final AddressDetail ADDRESS =
      new AddressDetail(
          "geo-42", "1 Main St", null, "Springfield", "IL", "62701", "US", 39.8, -89.6);

  private MutableClock clock;
  private InMemoryConsumerCache cache;
  private ConsumerKeySpaceResolver resolver;
  private ReadThroughCache readThroughCache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    cache = new InMemoryConsumerCache(clock);
    resolver = new ConsumerKeySpaceResolver();
    readThroughCache =
        ProfileTestFixtures.readThroughCache(
            cache, resolver, new ProfileMetrics(new SimpleMeterRegistry()));
  }

  @Test
  void addressDetailIsCachedByGeoAddressId() {
    final AtomicInteger calls = new AtomicInteger();
    final AddressDetailRepository repository =
        new AddressDetailRepository(
            readThroughCache,
            resolver,
            geoAddressId -> {
              calls.incrementAndGet();
              return Optional.of(ADDRESS);
            });

    assertThat(repository.find(consumer(42))).contains(ADDRESS);
    assertThat(repository.find(consumer(42))).contains(ADDRESS);

    assertThat(calls).hasValue(1);
    assertThat(cache.ttlOf("cp:address:geo:geo-42")).contains(Duration.ofMinutes(30));
  }

  @Test
  void addressDetailWithoutDefaultAddressSkipsLookup() {
    final AddressDetailRepository repository =
        new AddressDetailRepository(
            readThroughCache,
            resolver,
            geoAddressId -> {
              throw new AssertionError("must not be called");
            });

    assertThat(repository.find(consumer(42).toBuilder().defaultAddressId(null).build()))
        .isEmpty();
  }

  @Test
  void missingAddressIsNotCached() {
    final AtomicInteger calls = new AtomicInteger();
    final AddressDetailRepository repository =
        new AddressDetailRepository(
            readThroughCache,
            resolver,
            geoAddressId -> {
              calls.incrementAndGet();
              return Optional.empty();
            });

    repository.find(consumer(42));
    repository.find(consumer(42));

    assertThat(calls).hasValue(2);
    assertThat(cache.liveKeys()).isEmpty();
  }

  @Test
  void scheduledDeliveryUsesShortTtlAndCanBeInvalidated() {
    final Instant scheduledAt = NOW.plus(Duration.ofHours(3));
    final AtomicInteger calls = new AtomicInteger();
    final ScheduledDeliveryRepository repository =
        new ScheduledDeliveryRepository(
            readThroughCache,
            resolver,
            consumerId -> {
              calls.incrementAndGet();
              return Optional.of(new ScheduledDelivery(scheduledAt));
            });
    final ConsumerRecord consumer = consumer(42);

    assertThat(repository.find(consumer)).contains(scheduledAt);
    assertThat(cache.ttlOf("cp:delivery:id:42")).contains(Duration.ofSeconds(30));

    repository.invalidate(consumer);
    repository.find(consumer);

    assertThat(calls).hasValue(2);
  }

  @Test
  void scheduledDeliveryExpiresAfterTtl() {
    final AtomicInteger calls = new AtomicInteger();
    final ScheduledDeliveryRepository repository =
        new ScheduledDeliveryRepository(
            readThroughCache,
            resolver,
            consumerId -> {
              calls.incrementAndGet();
              return Optional.of(new ScheduledDelivery(NOW));
            });

    repository.find(consumer(42));
    clock.advance(Duration.ofSeconds(31));
    repository.find(consumer(42));

    assertThat(calls).hasValue(2);
  }

  @Test
  void blockedItemsDefaultToEmptyWhenPersonaHasNoPolicy() {
    final BlockedItemPolicyRepository repository =
        new BlockedItemPolicyRepository(readThroughCache, resolver, consumerId -> Optional.empty());

    assertThat(repository.find(consumer(42))).isEmpty();
  }

  @Test
  void blockedItemsAreCachedPerConsumer() {
    final BlockedItemPolicyRepository repository =
        new BlockedItemPolicyRepository(
            readThroughCache,
            resolver,
            consumerId -> Optional.of(new BlockedItemPolicy(Set.of("alcohol", "tobacco"))));

    assertThat(repository.find(consumer(42))).containsExactlyInAnyOrder("alcohol", "tobacco");
    assertThat(cache.liveKeys()).containsExactly("cp:blocked:id:42");
  }

  @Test
  void sourceOutagePropagatesToCaller() {
    final BlockedItemPolicyRepository repository =
        new BlockedItemPolicyRepository(
            readThroughCache,
            resolver,
            consumerId -> {
              throw new EnrichmentUnavailableException(
                  "persona", EnrichmentUnavailableException.Reason.BAD_GATEWAY, "down");
            });

    assertThatThrownBy(() -> repository.find(consumer(42)))
        .isInstanceOf(EnrichmentUnavailableException.class);
    assertThat(cache.liveKeys()).isEmpty();
  }
}
