package com.example.profile.repository;

import com.example.profile.error.ProfileException;
import com.example.profile.model.AddressLink;
import com.example.profile.store.AddressLinkStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * consumer と住所の紐付け。件数が少なく参照も稀なためキャッシュしない。
 *
 * <p>紐付けの追加・削除は consumer 行のロック下で行い、既定住所が常に紐付け済みであることを保つ。
 */
@Component
@RequiredArgsConstructor
public class AddressLinkRepository {

  private final AddressLinkStore store;
  private final ConsumerRepository consumerRepository;
  private final StoreOperations storeOperations;
  private final Clock clock;

  /** 既に紐付いている住所は CONFLICT、存在しない consumer は NOT_FOUND。 */
  public AddressLink link(long consumerId, String geoAddressId, String label) {
    final AddressLink link = new AddressLink(consumerId, geoAddressId, label, Instant.now(clock));
    return consumerRepository.withLockedConsumer(
        "linkAddress", consumerId, consumer -> store.insert(link));
  }

  /** ロック済みの行で既定住所を判定する。既定住所は VALIDATION_ERROR、未紐付けは NOT_FOUND。 */
  public void unlink(long consumerId, String geoAddressId) {
    consumerRepository.withLockedConsumer(
        "unlinkAddress",
        consumerId,
        consumer -> {
          if (geoAddressId.equals(consumer.defaultAddressId())) {
            throw ProfileException.validation("default address cannot be removed");
          }
          if (!store.delete(consumerId, geoAddressId)) {
            throw ProfileException.notFound("address is not linked to the consumer");
          }
          return null;
        });
  }

  public List<AddressLink> list(long consumerId) {
    return storeOperations.read("listAddresses", () -> store.findByConsumerId(consumerId));
  }

  /** consumer 行のロックを保持したトランザクション内から呼ぶ。リトライはしない。 */
  public void requireLinked(long consumerId, String geoAddressId) {
    if (!store.exists(consumerId, geoAddressId)) {
      throw ProfileException.validation("address is not linked to the consumer");
    }
  }
}
