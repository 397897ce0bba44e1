package com.example.profile.client;

import com.example.profile.model.AddressDetail;
import java.util.Optional;

/** geo サービス。empty は住所が存在しないことを表す。 */
@FunctionalInterface
public interface AddressDetailSource {

  Optional<AddressDetail> resolve(String geoAddressId);
}
