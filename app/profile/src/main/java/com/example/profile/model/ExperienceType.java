package com.example.profile.model;

public enum ExperienceType {
  PRIMARY_BRAND,
  ALTERNATE_BRAND
}
