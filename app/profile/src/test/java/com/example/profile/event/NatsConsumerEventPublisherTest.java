package com.example.profile.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.common.event.ConsumerEventPayload;
import com.example.profile.config.NatsProperties;
import com.example.profile.service.ProfileMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NatsConsumerEventPublisherTest {

  private static final ConsumerEventPayload PAYLOAD =
      new ConsumerEventPayload(
          "evt-1",
          "consumer.updated",
          "2026-03-01T00:00:00Z",
          42L,
          "ext-42",
          "tenant-a",
          List.of("vip_tier"),
          "trace-1");

  @Mock private JetStream jetStream;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SimpleMeterRegistry registry;
  private NatsConsumerEventPublisher publisher;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    publisher =
        new NatsConsumerEventPublisher(
            jetStream,
            new NatsProperties(true, "nats://localhost:4222", null, null),
            objectMapper,
            new ProfileMetrics(registry));
  }

  @Test
  void publishesJsonWithDeduplicationHeader() throws Exception {
    when(jetStream.publish(eq("profile.consumer.updated"), any(Headers.class), any(byte[].class)))
        .thenReturn(mock(PublishAck.class));

    publisher.publish(ConsumerEventPublisher.TOPIC_UPDATED, PAYLOAD);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("profile.consumer.updated"), headers.capture(), body.capture());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo("evt-1");
    assertThat(headers.getValue().getFirst("consumer_id")).isEqualTo("42");
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("consumer_id").asLong()).isEqualTo(42L);
    assertThat(json.get("changed_fields").get(0).asText()).isEqualTo("vip_tier");
  }

  @Test
  void publishFailureIsCountedAndSwallowed() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("nats down"));

    assertThatCode(() -> publisher.publish(ConsumerEventPublisher.TOPIC_UPDATED, PAYLOAD))
        .doesNotThrowAnyException();
    assertThat(
            registry
                .get("profile.event.publish.error.total")
                .tag("topic", "consumer.updated")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void missingPublishAckIsCountedAndSwallowed() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(null);

    assertThatCode(() -> publisher.publish(ConsumerEventPublisher.TOPIC_CREATED, PAYLOAD))
        .doesNotThrowAnyException();
    assertThat(
            registry
                .get("profile.event.publish.error.total")
                .tag("topic", "consumer.created")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
