package com.example.profile.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CachePayloadCodec {

  private static final Logger logger = LoggerFactory.getLogger(CachePayloadCodec.class);

  private final ObjectMapper objectMapper;

  public CachePayloadCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encode(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize cache payload", ex);
    }
  }

  /** 壊れた payload はミス扱いにし、次の読み取りで Store から再構築させる。 */
  public <T> Optional<T> decode(String payload, Class<T> type) {
    try {
      return Optional.ofNullable(objectMapper.readValue(payload, type));
    } catch (JsonProcessingException ex) {
      logger.warn("cache payload decode failed type={}", type.getSimpleName(), ex);
      return Optional.empty();
    }
  }
}
