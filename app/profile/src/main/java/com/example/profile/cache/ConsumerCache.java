package com.example.profile.cache;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * TTL 付き key/value キャッシュ。高速化専用で、唯一の正本にはならない。
 *
 * <p>接続断などの障害は {@link CacheUnavailableException} で通知する。
 */
public interface ConsumerCache {

  Optional<String> get(String key);

  void set(String key, String payload, Duration ttl);

  /** 存在しないキーの削除は成功扱い。重複・順不同の削除は結果に影響しない。 */
  void delete(Collection<String> keys);
}
