package com.example.profile.client;

import java.util.Optional;

@FunctionalInterface
public interface IdentitySource {

  Optional<VerifiedIdentity> resolve(String externalUserId);
}
