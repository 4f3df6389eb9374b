package bio.terra.adminauth.exception;

import bio.terra.adminauth.AdminAuthException;
import javax.annotation.Nullable;

/**
 * Predicates over errors raised by the auth core. Each one looks at the error and its causes, so a
 * revoked-token error (an invalid-token error wrapping a revoked-token error) answers true to both
 * {@link #isIdTokenInvalid} and {@link #isIdTokenRevoked}.
 */
public final class AuthErrors {
  private AuthErrors() {}

  public static boolean hasAuthErrorCode(@Nullable Throwable error, AuthErrorCode code) {
    for (var current = error; current != null; current = current.getCause()) {
      if (current instanceof AdminAuthException authException
          && authException.getAuthErrorCode().filter(code::equals).isPresent()) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
    }
    return false;
  }

  public static boolean hasErrorCode(@Nullable Throwable error, ErrorCode code) {
    return error instanceof AdminAuthException authException
        && authException.getErrorCode() == code;
  }

  public static boolean isIdTokenInvalid(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.ID_TOKEN_INVALID) || isIdTokenExpired(error);
  }

  public static boolean isIdTokenExpired(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.ID_TOKEN_EXPIRED);
  }

  public static boolean isIdTokenRevoked(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.ID_TOKEN_REVOKED);
  }

  public static boolean isSessionCookieInvalid(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.SESSION_COOKIE_INVALID)
        || isSessionCookieExpired(error);
  }

  public static boolean isSessionCookieExpired(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.SESSION_COOKIE_EXPIRED);
  }

  public static boolean isSessionCookieRevoked(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.SESSION_COOKIE_REVOKED);
  }

  public static boolean isUserDisabled(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.USER_DISABLED);
  }

  public static boolean isUserNotFound(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.USER_NOT_FOUND);
  }

  public static boolean isTenantIdMismatch(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.TENANT_ID_MISMATCH);
  }

  public static boolean isCertificateFetchFailed(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.CERTIFICATE_FETCH_FAILED);
  }

  public static boolean isInvalidCredential(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.INVALID_CREDENTIAL);
  }

  public static boolean isInsufficientPermission(@Nullable Throwable error) {
    return hasAuthErrorCode(error, AuthErrorCode.INSUFFICIENT_PERMISSION);
  }

  public static boolean isUnavailable(@Nullable Throwable error) {
    return hasErrorCode(error, ErrorCode.UNAVAILABLE);
  }
}
