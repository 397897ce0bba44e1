package com.example.profile.error;

public class ProfileException extends RuntimeException {

  private final ErrorCode code;

  public ProfileException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ProfileException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public static ProfileException notFound(String message) {
    return new ProfileException(ErrorCode.NOT_FOUND, message);
  }

  public static ProfileException validation(String message) {
    return new ProfileException(ErrorCode.VALIDATION_ERROR, message);
  }

  public static ProfileException validation(String message, Throwable cause) {
    return new ProfileException(ErrorCode.VALIDATION_ERROR, message, cause);
  }

  public static ProfileException conflict(String message, Throwable cause) {
    return new ProfileException(ErrorCode.CONFLICT, message, cause);
  }

  public static ProfileException unavailable(String message, Throwable cause) {
    return new ProfileException(ErrorCode.UNAVAILABLE, message, cause);
  }
}
