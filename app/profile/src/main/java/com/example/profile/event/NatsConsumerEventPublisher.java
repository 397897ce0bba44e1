/*
 * どこで: Profile イベント配信
 * 何を: consumer 変更イベントを JSON で NATS JetStream へ publish する
 * なぜ: 下流サービスが自身のキャッシュや派生データを追従できるようにするため
 */
package com.example.profile.event;

import com.example.common.event.ConsumerEventPayload;
import com.example.profile.config.NatsProperties;
import com.example.profile.service.ProfileMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class NatsConsumerEventPublisher implements ConsumerEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NatsConsumerEventPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_CONSUMER_ID = "consumer_id";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final NatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final ProfileMetrics metrics;

  @Override
  public void publish(String topic, ConsumerEventPayload payload) {
    final String subject = natsProperties.subjectFor(topic);
    try {
      final byte[] body = objectMapper.writeValueAsBytes(payload);
      final PublishAck ack = jetStream.publish(subject, buildHeaders(payload), body);
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
      logger.debug(
          "consumer event published subject={} eventId={} seq={}",
          subject,
          payload.eventId(),
          ack.getSeqno());
    } catch (JetStreamApiException | IOException | RuntimeException ex) {
      // JSON 変換失敗 (JsonProcessingException) も IOException として扱う
      handleFailure(topic, payload, ex);
    }
  }

  private Headers buildHeaders(ConsumerEventPayload payload) {
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, payload.eventType());
    headers.add(HEADER_CONSUMER_ID, String.valueOf(payload.consumerId()));
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    headers.add(HEADER_TRACE_ID, payload.traceId());
    return headers;
  }

  // 書き込みはコミット済みのため、配信失敗で呼び出し元を失敗させない
  private void handleFailure(String topic, ConsumerEventPayload payload, Exception ex) {
    metrics.recordEventPublishError(topic);
    logger.warn(
        "consumer event publish failed topic={} eventId={} consumerId={}",
        topic,
        payload.eventId(),
        payload.consumerId(),
        ex);
  }
}
