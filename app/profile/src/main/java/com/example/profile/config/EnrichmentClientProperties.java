/*
 * どこで: Profile アプリの設定バインド
 * 何を: geo / delivery / persona / identity 各サービスの接続先とタイムアウトを保持する
 * なぜ: 付与情報の取得先を環境ごとに切り替えるため
 */
package com.example.profile.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "profile.clients")
public record EnrichmentClientProperties(
    Endpoint geo, Endpoint delivery, Endpoint persona, Endpoint identity) {

  public EnrichmentClientProperties {
    geo = Endpoint.orDefault(geo, "http://geo:80", "/addresses/{geoAddressId}");
    delivery =
        Endpoint.orDefault(delivery, "http://delivery:80", "/consumers/{consumerId}/schedule");
    persona =
        Endpoint.orDefault(persona, "http://persona:80", "/consumers/{consumerId}/blocked-items");
    identity =
        Endpoint.orDefault(identity, "http://identity:80", "/identities/{externalUserId}");
  }

  public record Endpoint(
      String baseUrl, String path, Duration connectTimeout, Duration readTimeout) {

    public Endpoint {
      connectTimeout = connectTimeout == null ? Duration.ofMillis(200) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofMillis(250) : readTimeout;
    }

    static Endpoint orDefault(Endpoint endpoint, String defaultBaseUrl, String defaultPath) {
      if (endpoint == null) {
        return new Endpoint(defaultBaseUrl, defaultPath, null, null);
      }
      return new Endpoint(
          isBlank(endpoint.baseUrl()) ? defaultBaseUrl : endpoint.baseUrl(),
          isBlank(endpoint.path()) ? defaultPath : endpoint.path(),
          endpoint.connectTimeout(),
          endpoint.readTimeout());
    }

    private static boolean isBlank(String value) {
      return value == null || value.isBlank();
    }
  }
}
