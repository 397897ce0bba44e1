/*
 * どこで: Profile サービス層
 * 何を: consumer レコードに住所詳細・配達予定・利用規約・購入制限を並列に付与する
 * なぜ: 付与情報の取得失敗や遅延で profile 読み取り全体を失敗させないため
 */
package com.example.profile.service;

import com.example.profile.client.EnrichmentUnavailableException;
import com.example.profile.config.ProfileDecoratorProperties;
import com.example.profile.error.ErrorCode;
import com.example.profile.error.ProfileException;
import com.example.profile.model.AddressDetail;
import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.DecoratedConsumerView;
import com.example.profile.model.EnrichmentField;
import com.example.profile.model.ProfileType;
import com.example.profile.model.TermsOfServiceStatus;
import com.example.profile.repository.AddressDetailRepository;
import com.example.profile.repository.BlockedItemPolicyRepository;
import com.example.profile.repository.ConsumerRepository;
import com.example.profile.repository.ScheduledDeliveryRepository;
import com.example.profile.repository.TermsOfServiceRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * decorated view の組み立て。
 *
 * <p>profile type が要求する付与項目だけを専用の有界スレッドプールで並列に取得し、全体で共通の期限まで待つ。
 * 期限切れの取得はキャンセルする。付与項目の失敗はその項目を欠落させて WARN ログとメトリクスに残し、
 * 呼び出しは失敗させない。失敗するのは基底レコードが取得できない場合と、呼び出しスレッドが割り込まれた場合のみ。
 */
@Service
public class ConsumerDecorator {

  private static final Logger logger = LoggerFactory.getLogger(ConsumerDecorator.class);

  private final ConsumerRepository consumerRepository;
  private final AddressDetailRepository addressDetailRepository;
  private final ScheduledDeliveryRepository scheduledDeliveryRepository;
  private final TermsOfServiceRepository termsOfServiceRepository;
  private final BlockedItemPolicyRepository blockedItemPolicyRepository;
  private final ExecutorService executor;
  private final ProfileDecoratorProperties properties;
  private final ProfileMetrics metrics;

  public ConsumerDecorator(
      ConsumerRepository consumerRepository,
      AddressDetailRepository addressDetailRepository,
      ScheduledDeliveryRepository scheduledDeliveryRepository,
      TermsOfServiceRepository termsOfServiceRepository,
      BlockedItemPolicyRepository blockedItemPolicyRepository,
      @Qualifier("profileDecoratorExecutor") ExecutorService executor,
      ProfileDecoratorProperties properties,
      ProfileMetrics metrics) {
    this.consumerRepository = consumerRepository;
    this.addressDetailRepository = addressDetailRepository;
    this.scheduledDeliveryRepository = scheduledDeliveryRepository;
    this.termsOfServiceRepository = termsOfServiceRepository;
    this.blockedItemPolicyRepository = blockedItemPolicyRepository;
    this.executor = executor;
    this.properties = properties;
    this.metrics = metrics;
  }

  /** 基底レコードが存在しなければ NOT_FOUND。 */
  public DecoratedConsumerView decorate(long consumerId, ProfileType profileType) {
    return decorate(consumerRepository.get(consumerId), profileType);
  }

  public DecoratedConsumerView decorate(ConsumerRecord consumer, ProfileType profileType) {
    final Set<EnrichmentField> requested = profileType.enrichments();
    final Set<EnrichmentField> degraded = EnumSet.noneOf(EnrichmentField.class);
    final List<Future<?>> submitted = new ArrayList<>();

    final Future<Optional<AddressDetail>> address =
        submit(
            EnrichmentField.ADDRESS_DETAIL,
            requested,
            () -> addressDetailRepository.find(consumer),
            submitted,
            degraded);
    final Future<Optional<Instant>> delivery =
        submit(
            EnrichmentField.SCHEDULED_DELIVERY,
            requested,
            () -> scheduledDeliveryRepository.find(consumer),
            submitted,
            degraded);
    final Future<TermsOfServiceStatus> terms =
        submit(
            EnrichmentField.TERMS_OF_SERVICE,
            requested,
            () -> termsOfServiceRepository.find(consumer),
            submitted,
            degraded);
    final Future<Set<String>> blockedItems =
        submit(
            EnrichmentField.BLOCKED_ITEM_TYPES,
            requested,
            () -> blockedItemPolicyRepository.find(consumer),
            submitted,
            degraded);

    final long deadline = System.nanoTime() + properties.lookupTimeout().toNanos();
    try {
      final Optional<AddressDetail> addressDetail =
          await(EnrichmentField.ADDRESS_DETAIL, address, deadline, consumer, degraded);
      final Optional<Instant> scheduledDeliveryAt =
          await(EnrichmentField.SCHEDULED_DELIVERY, delivery, deadline, consumer, degraded);
      final TermsOfServiceStatus termsOfService =
          await(EnrichmentField.TERMS_OF_SERVICE, terms, deadline, consumer, degraded);
      final Set<String> blockedItemTypes =
          await(EnrichmentField.BLOCKED_ITEM_TYPES, blockedItems, deadline, consumer, degraded);
      return new DecoratedConsumerView(
          consumer,
          profileType,
          addressDetail,
          scheduledDeliveryAt,
          Optional.ofNullable(termsOfService),
          blockedItemTypes,
          degraded);
    } catch (InterruptedException ex) {
      submitted.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw ProfileException.unavailable("profile decoration interrupted", ex);
    }
  }

  private <T> Future<T> submit(
      EnrichmentField field,
      Set<EnrichmentField> requested,
      Supplier<T> lookup,
      List<Future<?>> submitted,
      Set<EnrichmentField> degraded) {
    if (!requested.contains(field)) {
      return null;
    }
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    try {
      final Future<T> future = executor.submit(() -> timed(field, lookup, mdc));
      submitted.add(future);
      return future;
    } catch (RejectedExecutionException ex) {
      logger.warn("profile decoration rejected field={}", field.metricName(), ex);
      degrade(field, "rejected", degraded);
      return null;
    }
  }

  private <T> T timed(EnrichmentField field, Supplier<T> lookup, Map<String, String> mdc) {
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    final long startedAt = System.nanoTime();
    String result = "failure";
    try {
      final T value = lookup.get();
      result = "success";
      return value;
    } finally {
      metrics.recordDecorationLookupDuration(
          field.metricName(), result, Duration.ofNanos(System.nanoTime() - startedAt));
      MDC.clear();
    }
  }

  private <T> T await(
      EnrichmentField field,
      Future<T> future,
      long deadline,
      ConsumerRecord consumer,
      Set<EnrichmentField> degraded)
      throws InterruptedException {
    if (future == null) {
      return null;
    }
    try {
      final long remaining = Math.max(0L, deadline - System.nanoTime());
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      logger.warn(
          "profile decoration timed out consumerId={} field={}",
          consumer.consumerId(),
          field.metricName());
      degrade(field, "timeout", degraded);
    } catch (CancellationException ex) {
      degrade(field, "cancelled", degraded);
    } catch (ExecutionException ex) {
      final String reason = reasonOf(ex.getCause());
      logger.warn(
          "profile decoration failed consumerId={} field={} reason={}",
          consumer.consumerId(),
          field.metricName(),
          reason,
          ex.getCause());
      degrade(field, reason, degraded);
    }
    return null;
  }

  private void degrade(EnrichmentField field, String reason, Set<EnrichmentField> degraded) {
    degraded.add(field);
    metrics.recordDecorationDegraded(field.metricName(), reason);
  }

  private String reasonOf(Throwable cause) {
    if (cause instanceof EnrichmentUnavailableException) {
      return "unavailable";
    }
    if (cause instanceof ProfileException profileException) {
      return profileException.code() == ErrorCode.NOT_FOUND ? "not_found" : "unavailable";
    }
    return "error";
  }
}
