package com.example.profile.repository;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.client.DeliveryScheduleSource;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ScheduledDelivery;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 既定住所に対する次回配達予定。既定住所が未設定なら問い合わせない。 */
@Component
@RequiredArgsConstructor
public class ScheduledDeliveryRepository {

  private final ReadThroughCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final DeliveryScheduleSource source;

  public Optional<Instant> find(ConsumerRecord consumer) {
    if (consumer.defaultAddressId() == null) {
      return Optional.empty();
    }
    final KeyDescriptor key = firstKey(consumer);
    return cache
        .getOrLoad(
            key,
            ScheduledDelivery.class,
            () -> source.resolve(String.valueOf(consumer.consumerId())))
        .map(ScheduledDelivery::scheduledAt);
  }

  public void invalidate(ConsumerRecord consumer) {
    cache.invalidate(resolver.keysFor(CacheUseCase.SCHEDULED_DELIVERY, consumer));
  }

  private KeyDescriptor firstKey(ConsumerRecord consumer) {
    return resolver.keysFor(CacheUseCase.SCHEDULED_DELIVERY, consumer).iterator().next();
  }
}
