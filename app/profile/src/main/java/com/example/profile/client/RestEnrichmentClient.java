/*
 * どこで: Profile 付与情報クライアント
 * 何を: 下流 HTTP サービスから 1 件の参照 ID に対する付与情報を取得する
 * なぜ: 404 と障害を区別し、Decorator が劣化理由を判断できる例外へ変換するため
 */
package com.example.profile.client;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * 下流サービス 1 つ分の GET クライアント。
 *
 * <p>404 は {@link Optional#empty()}、5xx・タイムアウト・接続失敗・不正な応答は {@link
 * EnrichmentUnavailableException} で返す。
 */
public class RestEnrichmentClient<T> {

  private static final Logger logger = LoggerFactory.getLogger(RestEnrichmentClient.class);

  private final String dependency;
  private final RestClient restClient;
  private final String path;
  private final Class<T> responseType;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public RestEnrichmentClient(
      String dependency, RestClient restClient, String path, Class<T> responseType) {
    this.dependency = dependency;
    this.restClient = restClient;
    this.path = path;
    this.responseType = responseType;
  }

  public Optional<T> fetch(String refId) {
    if (refId == null || refId.isBlank()) {
      throw new IllegalArgumentException(dependency + " reference id is required");
    }
    try {
      final T body = restClient.get().uri(path, refId).retrieve().body(responseType);
      if (body == null) {
        throw new EnrichmentUnavailableException(
            dependency,
            EnrichmentUnavailableException.Reason.INVALID_RESPONSE,
            dependency + " response is empty");
      }
      return Optional.of(body);
    } catch (RestClientResponseException ex) {
      if (ex.getStatusCode().value() == 404) {
        return Optional.empty();
      }
      throw mapResponseException(ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex);
    } catch (EnrichmentUnavailableException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("{} response parse failed", dependency, ex);
      throw new EnrichmentUnavailableException(
          dependency,
          EnrichmentUnavailableException.Reason.INVALID_RESPONSE,
          dependency + " response parse failed",
          ex);
    }
  }

  private EnrichmentUnavailableException mapResponseException(RestClientResponseException ex) {
    logger.warn(
        "{} lookup failed with http status={} statusText={}",
        dependency,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final String message =
        ex.getStatusCode().is5xxServerError()
            ? dependency + " server error"
            : dependency + " request failed";
    return new EnrichmentUnavailableException(
        dependency, EnrichmentUnavailableException.Reason.BAD_GATEWAY, message, ex);
  }

  private EnrichmentUnavailableException mapResourceException(ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("{} lookup timed out", dependency);
      return new EnrichmentUnavailableException(
          dependency,
          EnrichmentUnavailableException.Reason.TIMEOUT,
          dependency + " request timeout",
          ex);
    }
    logger.warn("{} lookup connection failed", dependency, ex);
    return new EnrichmentUnavailableException(
        dependency,
        EnrichmentUnavailableException.Reason.BAD_GATEWAY,
        dependency + " connection failed",
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
