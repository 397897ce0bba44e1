package com.example.profile.cache;

/** 解決表に存在しない用途を指定した。無効化漏れを防ぐため呼び出し側で握りつぶさないこと。 */
public class UnsupportedUseCaseException extends IllegalStateException {

  public UnsupportedUseCaseException(String message) {
    super(message);
  }
}
