package bio.terra.adminauth.exception;

import java.util.Arrays;
import java.util.Map;
import javax.annotation.Nullable;

/** Platform-wide error categories. Coarse-grained; see {@link AuthErrorCode} for the fine codes. */
public enum ErrorCode {
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  OUT_OF_RANGE,
  UNAUTHENTICATED,
  PERMISSION_DENIED,
  NOT_FOUND,
  CONFLICT,
  ABORTED,
  ALREADY_EXISTS,
  RESOURCE_EXHAUSTED,
  CANCELLED,
  DATA_LOSS,
  UNKNOWN,
  INTERNAL,
  UNAVAILABLE,
  DEADLINE_EXCEEDED;

  private static final Map<Integer, ErrorCode> HTTP_STATUS_TO_ERROR_CODE =
      Map.of(
          400, INVALID_ARGUMENT,
          401, UNAUTHENTICATED,
          403, PERMISSION_DENIED,
          404, NOT_FOUND,
          409, CONFLICT,
          429, RESOURCE_EXHAUSTED,
          500, INTERNAL,
          503, UNAVAILABLE);

  public static ErrorCode fromHttpStatus(int status) {
    return HTTP_STATUS_TO_ERROR_CODE.getOrDefault(status, UNKNOWN);
  }

  /** Maps the {@code error.status} string of a platform error response, if it names a category. */
  public static ErrorCode fromPlatformStatus(@Nullable String status, ErrorCode defaultCode) {
    if (status == null || status.isEmpty()) {
      return defaultCode;
    }
    return Arrays.stream(values())
        .filter(code -> code.name().equals(status))
        .findFirst()
        .orElse(defaultCode);
  }
}
