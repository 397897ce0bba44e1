package com.example.profile.cache;

public enum KeyType {
  BY_INTERNAL_ID("id"),
  BY_EXTERNAL_USER_ID("ext"),
  BY_GEO_ADDRESS_ID("geo"),
  BY_IMMUTABLE_IDENTITY("imm");

  private final String segment;

  KeyType(String segment) {
    this.segment = segment;
  }

  public String segment() {
    return segment;
  }
}
