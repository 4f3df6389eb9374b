package bio.terra.adminauth;

import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import java.util.Optional;
import javax.annotation.Nullable;
import org.springframework.http.HttpStatusCode;

/**
 * Every failure surfaced by the auth core. Carries a coarse platform {@link ErrorCode}, an
 * optional SDK {@link AuthErrorCode} and, when the failure came from a remote service, the HTTP
 * status of that response.
 */
public class AdminAuthException extends RuntimeException {
  private final ErrorCode errorCode;
  private final @Nullable AuthErrorCode authErrorCode;
  private final @Nullable HttpStatusCode httpStatus;

  public AdminAuthException(ErrorCode errorCode, String message) {
    this(errorCode, null, message, null, null);
  }

  public AdminAuthException(ErrorCode errorCode, String message, Throwable cause) {
    this(errorCode, null, message, cause, null);
  }

  public AdminAuthException(
      ErrorCode errorCode, @Nullable AuthErrorCode authErrorCode, String message) {
    this(errorCode, authErrorCode, message, null, null);
  }

  public AdminAuthException(
      ErrorCode errorCode,
      @Nullable AuthErrorCode authErrorCode,
      String message,
      @Nullable Throwable cause) {
    this(errorCode, authErrorCode, message, cause, null);
  }

  public AdminAuthException(
      ErrorCode errorCode,
      @Nullable AuthErrorCode authErrorCode,
      String message,
      @Nullable Throwable cause,
      @Nullable HttpStatusCode httpStatus) {
    super(message, cause);
    this.errorCode = errorCode;
    this.authErrorCode = authErrorCode;
    this.httpStatus = httpStatus;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public Optional<AuthErrorCode> getAuthErrorCode() {
    return Optional.ofNullable(authErrorCode);
  }

  public Optional<HttpStatusCode> getHttpStatus() {
    return Optional.ofNullable(httpStatus);
  }
}
