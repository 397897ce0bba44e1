/*
 * どこで: Profile 付与情報クライアント
 * 何を: geo / delivery / persona / identity 呼び出しの失敗を表現する
 * なぜ: Decorator が失敗理由ごとに劣化させて計測できるようにするため
 */
package com.example.profile.client;

public class EnrichmentUnavailableException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final String dependency;
  private final Reason reason;

  public EnrichmentUnavailableException(String dependency, Reason reason, String message) {
    super(message);
    this.dependency = dependency;
    this.reason = reason;
  }

  public EnrichmentUnavailableException(
      String dependency, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.dependency = dependency;
    this.reason = reason;
  }

  public String dependency() {
    return dependency;
  }

  public Reason reason() {
    return reason;
  }
}
