package com.example.profile.model;

import java.time.Instant;

public record AddressLink(long consumerId, String geoAddressId, String label, Instant createdAt) {}
