/*
 * どこで: Profile キャッシュ層
 * 何を: 用途 (use case) ごとのキー生成表から物理キーと無効化対象キーを求める
 * なぜ: 読み取りと書き込みが常に同じキー集合を参照し、無効化漏れを起こさないため
 */
package com.example.profile.cache;

import com.example.profile.model.ConsumerField;
import com.example.profile.model.ConsumerRecord;
import com.google.common.annotations.VisibleForTesting;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * consumer の識別項目からキャッシュキーを決定する純粋関数の集まり。
 *
 * <p>I/O も可変状態も持たないため、並行する呼び出し同士で解決結果が食い違うことはない。
 * 表にない用途を渡された場合は {@link UnsupportedUseCaseException} で即座に失敗する。
 */
@Component
public class ConsumerKeySpaceResolver {

  private static final String KEY_PREFIX = "cp";
  private static final String SEPARATOR = ":";

  private final Map<CacheUseCase, List<KeyBuilder>> table;

  public ConsumerKeySpaceResolver() {
    this(defaultTable());
  }

  @VisibleForTesting
  ConsumerKeySpaceResolver(Map<CacheUseCase, List<KeyBuilder>> table) {
    final Map<CacheUseCase, List<KeyBuilder>> copy = new EnumMap<>(CacheUseCase.class);
    table.forEach((useCase, builders) -> copy.put(useCase, List.copyOf(builders)));
    this.table = Collections.unmodifiableMap(copy);
  }

  /** 用途に登録された key type の順で、入力が揃っているキーだけを返す。 */
  public Set<KeyDescriptor> keysFor(CacheUseCase useCase, ConsumerRecord consumer) {
    final List<KeyBuilder> builders = buildersFor(useCase);
    if (consumer == null) {
      throw new IllegalArgumentException("consumer is required");
    }
    final Set<KeyDescriptor> keys = new LinkedHashSet<>();
    for (KeyBuilder builder : builders) {
      final List<String> parts = builder.parts().apply(consumer);
      if (parts != null) {
        keys.add(new KeyDescriptor(builder.keyType(), useCase, parts));
      }
    }
    return Collections.unmodifiableSet(keys);
  }

  /** record を持たない検索 (外部ユーザー ID での逆引きなど) 用のキーを組み立てる。 */
  public KeyDescriptor lookupKey(CacheUseCase useCase, KeyType keyType, Object... parts) {
    final boolean registered =
        buildersFor(useCase).stream().anyMatch(builder -> builder.keyType() == keyType);
    if (!registered) {
      throw new UnsupportedUseCaseException(
          "key type " + keyType + " is not registered for use case " + useCase);
    }
    final List<String> values = partsOf(parts);
    if (values == null) {
      throw new IllegalArgumentException("lookup key parts must not be null");
    }
    return new KeyDescriptor(keyType, useCase, values);
  }

  public String physicalKey(KeyDescriptor descriptor) {
    buildersFor(descriptor.useCase());
    final String parts =
        descriptor.keyParts().stream()
            .map(part -> URLEncoder.encode(part, StandardCharsets.UTF_8))
            .collect(Collectors.joining(SEPARATOR));
    return String.join(
        SEPARATOR,
        KEY_PREFIX,
        descriptor.useCase().namespace(),
        descriptor.keyType().segment(),
        parts);
  }

  /**
   * 書き込みで無効化すべきキー。
   *
   * <p>キー入力またはキャッシュ値が内包する項目が変化した用途について、書き込み前と後の両方のキーを返す。
   * CONSUMER_READ は record 全体を内包するため常に対象。before が null なら新規作成として全用途を対象にする。
   */
  public Set<KeyDescriptor> invalidationKeys(ConsumerRecord before, ConsumerRecord after) {
    if (after == null) {
      throw new IllegalArgumentException("post-write consumer is required");
    }
    final Set<ConsumerField> changed = ConsumerField.changedBetween(before, after);
    final Set<KeyDescriptor> keys = new LinkedHashSet<>();
    for (Map.Entry<CacheUseCase, List<KeyBuilder>> entry : table.entrySet()) {
      if (!requiresInvalidation(entry.getKey(), entry.getValue(), changed)) {
        continue;
      }
      if (before != null) {
        keys.addAll(keysFor(entry.getKey(), before));
      }
      keys.addAll(keysFor(entry.getKey(), after));
    }
    return Collections.unmodifiableSet(keys);
  }

  /** 全用途のキー。削除 (recycle) 時に使う。 */
  public Set<KeyDescriptor> allKeys(ConsumerRecord consumer) {
    final Set<KeyDescriptor> keys = new LinkedHashSet<>();
    for (CacheUseCase useCase : table.keySet()) {
      keys.addAll(keysFor(useCase, consumer));
    }
    return Collections.unmodifiableSet(keys);
  }

  public Set<CacheUseCase> supportedUseCases() {
    return table.isEmpty() ? EnumSet.noneOf(CacheUseCase.class) : EnumSet.copyOf(table.keySet());
  }

  private boolean requiresInvalidation(
      CacheUseCase useCase, List<KeyBuilder> builders, Set<ConsumerField> changed) {
    if (useCase == CacheUseCase.CONSUMER_READ) {
      return true;
    }
    final Set<ConsumerField> dependencies = useCase.embeddedFields();
    builders.forEach(builder -> dependencies.addAll(builder.inputs()));
    return dependencies.stream().anyMatch(changed::contains);
  }

  private List<KeyBuilder> buildersFor(CacheUseCase useCase) {
    final List<KeyBuilder> builders = useCase == null ? null : table.get(useCase);
    if (builders == null) {
      throw new UnsupportedUseCaseException("unsupported cache use case: " + useCase);
    }
    return builders;
  }

  static Map<CacheUseCase, List<KeyBuilder>> defaultTable() {
    final KeyBuilder byInternalId =
        new KeyBuilder(
            KeyType.BY_INTERNAL_ID,
            EnumSet.of(ConsumerField.CONSUMER_ID),
            consumer -> partsOf(consumer.consumerId()));
    final Map<CacheUseCase, List<KeyBuilder>> table = new EnumMap<>(CacheUseCase.class);
    table.put(
        CacheUseCase.CONSUMER_READ,
        List.of(
            byInternalId,
            new KeyBuilder(
                KeyType.BY_EXTERNAL_USER_ID,
                EnumSet.of(
                    ConsumerField.TENANT_ID,
                    ConsumerField.EXPERIENCE_TYPE,
                    ConsumerField.EXTERNAL_USER_ID),
                consumer ->
                    partsOf(
                        consumer.tenantId(),
                        consumer.experienceType(),
                        consumer.externalUserId()))));
    table.put(
        CacheUseCase.IMMUTABLE_IDENTITY,
        List.of(
            new KeyBuilder(
                KeyType.BY_IMMUTABLE_IDENTITY,
                EnumSet.of(ConsumerField.CONSUMER_ID),
                consumer -> partsOf(consumer.consumerId()))));
    table.put(
        CacheUseCase.ADDRESS_DETAIL,
        List.of(
            new KeyBuilder(
                KeyType.BY_GEO_ADDRESS_ID,
                EnumSet.of(ConsumerField.DEFAULT_ADDRESS_ID),
                consumer -> partsOf(consumer.defaultAddressId()))));
    table.put(CacheUseCase.SCHEDULED_DELIVERY, List.of(byInternalId));
    table.put(CacheUseCase.TERMS_OF_SERVICE, List.of(byInternalId));
    table.put(CacheUseCase.BLOCKED_ITEM_POLICY, List.of(byInternalId));
    return table;
  }

  // 入力のどれかが欠けていればキーを作らない
  private static List<String> partsOf(Object... values) {
    if (values == null || values.length == 0 || Arrays.stream(values).anyMatch(Objects::isNull)) {
      return null;
    }
    return Arrays.stream(values).map(String::valueOf).toList();
  }

  /**
   * 1 つの key type の生成規則。
   *
   * @param inputs キー生成に使う consumer 項目
   * @param parts 入力が欠けていれば null を返す
   */
  record KeyBuilder(
      KeyType keyType, Set<ConsumerField> inputs, Function<ConsumerRecord, List<String>> parts) {

    KeyBuilder {
      inputs = EnumSet.copyOf(inputs);
    }
  }
}
