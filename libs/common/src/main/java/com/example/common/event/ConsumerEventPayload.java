/*
 * どこで: common のイベント payload 定義
 * 何を: consumer の作成/更新/削除イベントの JSON 形状を定義する
 * なぜ: publisher と購読側で同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsumerEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    long consumerId,
    String externalUserId,
    String tenantId,
    List<String> changedFields,
    String traceId) {

  public ConsumerEventPayload {
    changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
  }
}
