package com.example.profile.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** 現行の利用規約バージョン。同意状態はこの値と比較して判定する。 */
@Validated
@ConfigurationProperties(prefix = "profile.terms")
public record ProfileTermsProperties(@Positive int currentVersion) {}
