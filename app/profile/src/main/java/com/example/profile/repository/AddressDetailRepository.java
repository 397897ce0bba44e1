package com.example.profile.repository;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.client.AddressDetailSource;
import com.example.profile.model.AddressDetail;
import com.example.profile.model.ConsumerRecord;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 既定住所の詳細。geo address id 単位でキャッシュするため、同じ住所を持つ consumer 間で共有される。 */
@Component
@RequiredArgsConstructor
public class AddressDetailRepository {

  private final ReadThroughCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final AddressDetailSource source;

  public Optional<AddressDetail> find(ConsumerRecord consumer) {
    final Optional<KeyDescriptor> key =
        resolver.keysFor(CacheUseCase.ADDRESS_DETAIL, consumer).stream().findFirst();
    if (key.isEmpty()) {
      return Optional.empty();
    }
    return cache.getOrLoad(
        key.get(), AddressDetail.class, () -> source.resolve(consumer.defaultAddressId()));
  }
}
