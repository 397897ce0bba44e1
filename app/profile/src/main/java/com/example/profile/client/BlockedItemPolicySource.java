package com.example.profile.client;

import com.example.profile.model.BlockedItemPolicy;
import java.util.Optional;

@FunctionalInterface
public interface BlockedItemPolicySource {

  Optional<BlockedItemPolicy> resolve(String consumerId);
}
