package bio.terra.adminauth.exception;

import java.util.Map;
import javax.annotation.Nullable;

/** SDK-specific error codes. Error predicates compare these, never messages. */
public enum AuthErrorCode {
  ID_TOKEN_INVALID,
  ID_TOKEN_EXPIRED,
  ID_TOKEN_REVOKED,
  SESSION_COOKIE_INVALID,
  SESSION_COOKIE_EXPIRED,
  SESSION_COOKIE_REVOKED,
  USER_DISABLED,
  USER_NOT_FOUND,
  TENANT_ID_MISMATCH,
  TENANT_NOT_FOUND,
  PROJECT_NOT_FOUND,
  CONFIGURATION_NOT_FOUND,
  CERTIFICATE_FETCH_FAILED,
  INVALID_CREDENTIAL,
  INSUFFICIENT_PERMISSION,
  UNKNOWN;

  // server-side codes reported in error.message (user lookup) or error.status (IAM)
  private static final Map<String, AuthErrorCode> SERVER_ERROR_CODES =
      Map.of(
          "CONFIGURATION_NOT_FOUND", CONFIGURATION_NOT_FOUND,
          "INSUFFICIENT_PERMISSION", INSUFFICIENT_PERMISSION,
          "PERMISSION_DENIED", INSUFFICIENT_PERMISSION,
          "PROJECT_NOT_FOUND", PROJECT_NOT_FOUND,
          "TENANT_NOT_FOUND", TENANT_NOT_FOUND,
          "USER_NOT_FOUND", USER_NOT_FOUND);

  public static AuthErrorCode fromServerCode(@Nullable String serverCode) {
    if (serverCode == null) {
      return UNKNOWN;
    }
    return SERVER_ERROR_CODES.getOrDefault(serverCode, UNKNOWN);
  }
}
