package com.example.profile.model;

/**
 * 利用規約の同意状態。受理操作でのみ変化し、読み取りでは変化しない。
 *
 * @param acceptedLatest 現行バージョンに同意済みか
 * @param latestAcceptedVersion 同意済みの最新バージョン。未同意なら null
 */
public record TermsOfServiceStatus(boolean acceptedLatest, Integer latestAcceptedVersion) {

  public static TermsOfServiceStatus of(Integer latestAcceptedVersion, int currentVersion) {
    final boolean accepted =
        latestAcceptedVersion != null && latestAcceptedVersion >= currentVersion;
    return new TermsOfServiceStatus(accepted, latestAcceptedVersion);
  }
}
