package com.example.profile.model;

import java.util.Set;

public record BlockedItemPolicy(Set<String> blockedItemTypes) {

  public BlockedItemPolicy {
    blockedItemTypes = blockedItemTypes == null ? Set.of() : Set.copyOf(blockedItemTypes);
  }

  public static BlockedItemPolicy none() {
    return new BlockedItemPolicy(Set.of());
  }
}
