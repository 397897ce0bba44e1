/*
 * どこで: Profile アプリの設定バインド
 * 何を: NATS 接続先と consumer イベントの subject 接頭辞を読み込む
 * なぜ: 環境ごとの接続先と publish 先を安全に切り替えるため
 */
package com.example.profile.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Integer connectionTimeout, String subjectPrefix) {

  public NatsProperties {
    connectionTimeout = connectionTimeout == null ? 2 : connectionTimeout;
    subjectPrefix = subjectPrefix == null || subjectPrefix.isBlank() ? "profile" : subjectPrefix;
  }

  public String subjectFor(String topic) {
    return subjectPrefix + "." + topic;
  }
}
