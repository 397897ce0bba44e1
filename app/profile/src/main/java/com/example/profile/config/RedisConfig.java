/*
 * どこで: Profile インフラ設定
 * 何を: キャッシュ操作で利用する StringRedisTemplate を提供する
 * なぜ: キャッシュ値を JSON 文字列のまま Redis に置くため
 */
package com.example.profile.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RedisConfig {

  @Bean
  StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
