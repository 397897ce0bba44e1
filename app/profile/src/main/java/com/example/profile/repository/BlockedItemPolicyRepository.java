package com.example.profile.repository;

import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.client.BlockedItemPolicySource;
import com.example.profile.model.BlockedItemPolicy;
import com.example.profile.model.ConsumerRecord;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BlockedItemPolicyRepository {

  private final ReadThroughCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final BlockedItemPolicySource source;

  /** persona 側に定義が無い consumer は制限なしとして空集合を返す。 */
  public Set<String> find(ConsumerRecord consumer) {
    final KeyDescriptor key =
        resolver.keysFor(CacheUseCase.BLOCKED_ITEM_POLICY, consumer).iterator().next();
    return cache
        .getOrLoad(
            key,
            BlockedItemPolicy.class,
            () -> source.resolve(String.valueOf(consumer.consumerId())))
        .orElseGet(BlockedItemPolicy::none)
        .blockedItemTypes();
  }
}
