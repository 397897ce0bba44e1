/*
 * どこで: Profile アプリの設定バインド
 * 何を: decorated view 組み立て時の並列実行数とタイムアウトを保持する
 * なぜ: 付与情報の遅延がリクエスト全体の遅延にならないよう上限を外部化するため
 */
package com.example.profile.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.decorator")
public record ProfileDecoratorProperties(Duration lookupTimeout, int poolSize, int queueCapacity) {

  public ProfileDecoratorProperties {
    lookupTimeout =
        lookupTimeout == null || lookupTimeout.isNegative() || lookupTimeout.isZero()
            ? Duration.ofMillis(300)
            : lookupTimeout;
    poolSize = poolSize <= 0 ? 16 : poolSize;
    queueCapacity = queueCapacity <= 0 ? 256 : queueCapacity;
  }
}
