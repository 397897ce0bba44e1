package com.example.profile.client;

import com.example.profile.model.ScheduledDelivery;
import java.util.Optional;

/** 配達予定の推定は呼び出し先の責務。ここでは既定住所に対する結果を取得するだけ。 */
@FunctionalInterface
public interface DeliveryScheduleSource {

  Optional<ScheduledDelivery> resolve(String consumerId);
}
