package com.example.profile.event;

import com.example.common.event.ConsumerEventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** NATS 無効時 (ローカル実行・テスト) の publisher。 */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopConsumerEventPublisher implements ConsumerEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopConsumerEventPublisher.class);

  @Override
  public void publish(String topic, ConsumerEventPayload payload) {
    logger.debug(
        "nats disabled; consumer event dropped topic={} eventId={}", topic, payload.eventId());
  }
}
