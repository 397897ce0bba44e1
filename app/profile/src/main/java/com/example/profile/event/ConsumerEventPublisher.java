package com.example.profile.event;

import com.example.common.event.ConsumerEventPayload;

/**
 * コミット済みの consumer 変更を通知する。
 *
 * <p>fire-and-forget。実装は publish 失敗を呼び出し元へ伝播させない。
 */
public interface ConsumerEventPublisher {

  String TOPIC_CREATED = "consumer.created";
  String TOPIC_UPDATED = "consumer.updated";
  String TOPIC_DELETED = "consumer.deleted";

  void publish(String topic, ConsumerEventPayload payload);
}
