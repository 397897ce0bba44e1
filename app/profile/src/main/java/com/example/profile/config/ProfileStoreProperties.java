/*
 * どこで: Profile アプリの設定バインド
 * 何を: Store 読み取り失敗時のリトライ回数とバックオフを保持する
 * なぜ: 必須依存である Store の一時障害を、上限付きで吸収するため
 */
package com.example.profile.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.store")
public record ProfileStoreProperties(
    int readMaxAttempts, Duration readBackoffBase, Duration readBackoffMax) {

  public ProfileStoreProperties {
    readMaxAttempts = readMaxAttempts <= 0 ? 3 : readMaxAttempts;
    readBackoffBase = readBackoffBase == null ? Duration.ofMillis(20) : readBackoffBase;
    readBackoffMax = readBackoffMax == null ? Duration.ofMillis(200) : readBackoffMax;
  }
}
