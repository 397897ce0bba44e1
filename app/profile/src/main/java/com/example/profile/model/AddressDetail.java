package com.example.profile.model;

public record AddressDetail(
    String geoAddressId,
    String line1,
    String line2,
    String city,
    String administrativeArea,
    String postalCode,
    String countryCode,
    Double latitude,
    Double longitude) {}
