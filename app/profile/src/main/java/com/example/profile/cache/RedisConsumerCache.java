/*
 * どこで: Profile キャッシュ層
 * 何を: ConsumerCache を Redis の文字列値として実装する
 * なぜ: TTL 付きの分散キャッシュを Repository から差し替え可能な形で使うため
 */
package com.example.profile.cache;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisConsumerCache implements ConsumerCache {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisConsumerCache(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException ex) {
      throw new CacheUnavailableException("redis get failed", ex);
    }
  }

  @Override
  public void set(String key, String payload, Duration ttl) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    try {
      redisTemplate.opsForValue().set(key, payload, ttl);
    } catch (DataAccessException ex) {
      throw new CacheUnavailableException("redis set failed", ex);
    }
  }

  @Override
  public void delete(Collection<String> keys) {
    if (keys == null || keys.isEmpty()) {
      return;
    }
    try {
      redisTemplate.delete(keys);
    } catch (DataAccessException ex) {
      throw new CacheUnavailableException("redis delete failed", ex);
    }
  }
}
