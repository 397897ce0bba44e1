/*
 * どこで: Profile 付与情報クライアント設定
 * 何を: 下流サービスごとの RestClient と参照インターフェースの実装を提供する
 * なぜ: 接続先とタイムアウトを依存先ごとに分離し、コア層を HTTP から切り離すため
 */
package com.example.profile.client;

import com.example.profile.config.EnrichmentClientProperties;
import com.example.profile.config.EnrichmentClientProperties.Endpoint;
import com.example.profile.model.AddressDetail;
import com.example.profile.model.BlockedItemPolicy;
import com.example.profile.model.ScheduledDelivery;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class EnrichmentClientConfig {

  @Bean
  AddressDetailSource addressDetailSource(
      RestClient.Builder builder, EnrichmentClientProperties properties) {
    final RestEnrichmentClient<AddressDetail> client =
        client("geo", builder, properties.geo(), AddressDetail.class);
    return client::fetch;
  }

  @Bean
  DeliveryScheduleSource deliveryScheduleSource(
      RestClient.Builder builder, EnrichmentClientProperties properties) {
    final RestEnrichmentClient<ScheduledDelivery> client =
        client("delivery", builder, properties.delivery(), ScheduledDelivery.class);
    return client::fetch;
  }

  @Bean
  BlockedItemPolicySource blockedItemPolicySource(
      RestClient.Builder builder, EnrichmentClientProperties properties) {
    final RestEnrichmentClient<BlockedItemPolicy> client =
        client("persona", builder, properties.persona(), BlockedItemPolicy.class);
    return client::fetch;
  }

  @Bean
  IdentitySource identitySource(
      RestClient.Builder builder, EnrichmentClientProperties properties) {
    final RestEnrichmentClient<VerifiedIdentity> client =
        client("identity", builder, properties.identity(), VerifiedIdentity.class);
    return client::fetch;
  }

  // RestClient.Builder はプロトタイプスコープだが、clone して依存先ごとの設定が混ざらないようにする
  private static <T> RestEnrichmentClient<T> client(
      String dependency, RestClient.Builder builder, Endpoint endpoint, Class<T> responseType) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(endpoint.connectTimeout());
    requestFactory.setReadTimeout(endpoint.readTimeout());
    final RestClient restClient =
        builder.clone().baseUrl(endpoint.baseUrl()).requestFactory(requestFactory).build();
    return new RestEnrichmentClient<>(dependency, restClient, endpoint.path(), responseType);
  }
}
