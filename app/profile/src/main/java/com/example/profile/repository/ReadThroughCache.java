/*
 * どこで: Profile Repository 層
 * 何を: キャッシュ読み取り・充填・無効化の共通手順を提供する
 * なぜ: 各 Repository が同じ手順でキャッシュ障害を吸収し、用途ごとの TTL を適用するため
 */
package com.example.profile.repository;

import com.example.profile.cache.CachePayloadCodec;
import com.example.profile.cache.CacheUnavailableException;
import com.example.profile.cache.CacheUseCase;
import com.example.profile.cache.ConsumerCache;
import com.example.profile.cache.ConsumerKeySpaceResolver;
import com.example.profile.cache.KeyDescriptor;
import com.example.profile.config.ProfileCacheProperties;
import com.example.profile.service.ProfileMetrics;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * キャッシュは高速化専用で、障害はここで吸収する。
 *
 * <p>読み取り障害はミス、充填・削除の障害は WARN ログとメトリクスのみで呼び出し元には伝えない。
 * 削除に失敗したエントリは用途ごとの TTL で失効する。
 */
@Component
@RequiredArgsConstructor
public class ReadThroughCache {

  private static final Logger logger = LoggerFactory.getLogger(ReadThroughCache.class);

  private final ConsumerCache cache;
  private final ConsumerKeySpaceResolver resolver;
  private final CachePayloadCodec codec;
  private final ProfileCacheProperties properties;
  private final ProfileMetrics metrics;

  public <T> Optional<T> read(KeyDescriptor key, Class<T> type) {
    final String physicalKey = resolver.physicalKey(key);
    final String useCase = key.useCase().metricName();
    final Optional<String> payload;
    try {
      payload = cache.get(physicalKey);
    } catch (CacheUnavailableException ex) {
      logger.warn("cache read failed; falling back to store key={}", physicalKey, ex);
      metrics.recordCacheError("get");
      metrics.recordCacheLookup(useCase, "error");
      return Optional.empty();
    }
    if (payload.isEmpty()) {
      metrics.recordCacheLookup(useCase, "miss");
      return Optional.empty();
    }
    final Optional<T> decoded = codec.decode(payload.get(), type);
    metrics.recordCacheLookup(useCase, decoded.isPresent() ? "hit" : "miss");
    return decoded;
  }

  public void populate(Collection<KeyDescriptor> keys, Object value) {
    if (keys.isEmpty()) {
      return;
    }
    final String payload = codec.encode(value);
    for (KeyDescriptor key : keys) {
      final String physicalKey = resolver.physicalKey(key);
      try {
        cache.set(physicalKey, payload, properties.ttlFor(key.useCase()));
      } catch (CacheUnavailableException ex) {
        logger.warn("cache populate failed key={}", physicalKey, ex);
        metrics.recordCacheError("set");
      }
    }
  }

  /** 冪等。同じキー集合を何度削除しても、順序が入れ替わっても結果は同じ。 */
  public void invalidate(Collection<KeyDescriptor> keys) {
    if (keys.isEmpty()) {
      return;
    }
    final Set<String> physicalKeys = new LinkedHashSet<>();
    final Map<CacheUseCase, Integer> counts = new EnumMap<>(CacheUseCase.class);
    for (KeyDescriptor key : keys) {
      if (physicalKeys.add(resolver.physicalKey(key))) {
        counts.merge(key.useCase(), 1, Integer::sum);
      }
    }
    try {
      cache.delete(List.copyOf(physicalKeys));
    } catch (CacheUnavailableException ex) {
      logger.warn("cache invalidation failed; entries expire by ttl keys={}", physicalKeys, ex);
      metrics.recordCacheError("delete");
      return;
    }
    counts.forEach((useCase, count) -> metrics.recordInvalidation(useCase.metricName(), count));
  }

  public <T> Optional<T> getOrLoad(KeyDescriptor key, Class<T> type, Supplier<Optional<T>> loader) {
    return getOrLoad(key, type, loader, value -> List.of(key));
  }

  /**
   * ヒットなら Store に触れずに返す。ミスなら loader で読み、populateKeys の全キーへ書いてから返す。
   *
   * <p>loader が empty を返した場合は何もキャッシュしない。
   */
  public <T> Optional<T> getOrLoad(
      KeyDescriptor key,
      Class<T> type,
      Supplier<Optional<T>> loader,
      Function<T, ? extends Collection<KeyDescriptor>> populateKeys) {
    final Optional<T> cached = read(key, type);
    if (cached.isPresent()) {
      return cached;
    }
    final Optional<T> loaded = loader.get();
    loaded.ifPresent(value -> populate(populateKeys.apply(value), value));
    return loaded;
  }
}
