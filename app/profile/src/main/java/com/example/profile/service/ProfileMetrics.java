/*
 * どこで: Profile サービス層
 * 何を: キャッシュのヒット率・無効化件数・付与情報の劣化・イベント publish 失敗を記録する
 * なぜ: キャッシュ障害や依存先劣化がリクエスト失敗にならない代わりに、Prometheus から観測できるようにするため
 */
package com.example.profile.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ProfileMetrics {

  private static final String METRIC_CACHE_LOOKUP_TOTAL = "profile.cache.lookup.total";
  private static final String METRIC_CACHE_ERROR_TOTAL = "profile.cache.error.total";
  private static final String METRIC_CACHE_INVALIDATION_TOTAL = "profile.cache.invalidation.total";
  private static final String METRIC_DECORATION_DEGRADED_TOTAL =
      "profile.decoration.degraded.total";
  private static final String METRIC_DECORATION_LOOKUP_DURATION =
      "profile.decoration.lookup.duration";
  private static final String METRIC_STORE_READ_RETRY_TOTAL = "profile.store.read.retry.total";
  private static final String METRIC_EVENT_PUBLISH_ERROR_TOTAL =
      "profile.event.publish.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> cacheLookupCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> cacheErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> invalidationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> degradedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> lookupTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> publishErrorCounters = new ConcurrentHashMap<>();
  private final Counter storeReadRetryCounter;

  public ProfileMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.storeReadRetryCounter =
        Counter.builder(METRIC_STORE_READ_RETRY_TOTAL)
            .description("Store read retries after transient failures")
            .register(meterRegistry);
  }

  /** result は hit / miss / error のいずれか。 */
  public void recordCacheLookup(String useCase, String result) {
    final String key = useCase + "|" + result;
    cacheLookupCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_CACHE_LOOKUP_TOTAL)
                    .description("Profile cache lookups by use case and outcome")
                    .tags(Tags.of("use_case", useCase, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCacheError(String operation) {
    cacheErrorCounters
        .computeIfAbsent(
            operation,
            ignored ->
                Counter.builder(METRIC_CACHE_ERROR_TOTAL)
                    .description("Profile cache operations recovered locally")
                    .tags(Tags.of("operation", operation))
                    .register(meterRegistry))
        .increment();
  }

  public void recordInvalidation(String useCase, int keyCount) {
    if (keyCount <= 0) {
      return;
    }
    invalidationCounters
        .computeIfAbsent(
            useCase,
            ignored ->
                Counter.builder(METRIC_CACHE_INVALIDATION_TOTAL)
                    .description("Profile cache keys deleted on write")
                    .tags(Tags.of("use_case", useCase))
                    .register(meterRegistry))
        .increment(keyCount);
  }

  public void recordDecorationDegraded(String field, String reason) {
    final String key = field + "|" + reason;
    degradedCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DECORATION_DEGRADED_TOTAL)
                    .description("Decorated profile fields dropped because a lookup failed")
                    .tags(Tags.of("field", field, "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDecorationLookupDuration(String field, String result, Duration duration) {
    final String key = field + "|" + result;
    lookupTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_DECORATION_LOOKUP_DURATION)
                    .description("Decorated profile enrichment lookup duration")
                    .tags(Tags.of("field", field, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordStoreReadRetry() {
    storeReadRetryCounter.increment();
  }

  public void recordEventPublishError(String topic) {
    publishErrorCounters
        .computeIfAbsent(
            topic,
            ignored ->
                Counter.builder(METRIC_EVENT_PUBLISH_ERROR_TOTAL)
                    .description("Consumer event publish failures after commit")
                    .tags(Tags.of("topic", topic))
                    .register(meterRegistry))
        .increment();
  }
}
