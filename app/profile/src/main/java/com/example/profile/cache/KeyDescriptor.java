package com.example.profile.cache;

import java.util.List;

/** (key type, use case) と入力値の組。物理キーへの変換は {@link ConsumerKeySpaceResolver} が行う。 */
public record KeyDescriptor(KeyType keyType, CacheUseCase useCase, List<String> keyParts) {

  public KeyDescriptor {
    if (keyType == null || useCase == null) {
      throw new IllegalArgumentException("keyType and useCase are required");
    }
    if (keyParts == null || keyParts.isEmpty()) {
      throw new IllegalArgumentException("keyParts are required");
    }
    keyParts = List.copyOf(keyParts);
  }
}
