package com.example.profile.model;

public enum VipTier {
  SILVER,
  GOLD,
  PLATINUM
}
