package bio.terra.adminauth.util;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;

/** Turns error responses of Google platform APIs into {@link AdminAuthException}s. */
@Slf4j
public final class PlatformErrors {
  private PlatformErrors() {}

  /**
   * Builds an error from a {@code {"error": {"status": ..., "message": ...}}} body. The category
   * comes from {@code error.status} when present and from the HTTP status otherwise; the message
   * is {@code error.message}, or a description of the raw response when the body has none.
   */
  public static AdminAuthException fromPlatformResponse(
      ObjectMapper objectMapper, ResponseEntity<String> response) {
    var body = Objects.requireNonNullElse(response.getBody(), "");
    var status = response.getStatusCode().value();
    var error = readError(objectMapper, body);

    var errorCode =
        ErrorCode.fromPlatformStatus(
            error.path("status").asText(""), ErrorCode.fromHttpStatus(status));
    var message = error.path("message").asText("");
    if (message.isEmpty()) {
      message = String.format("unexpected http response with status: %d\n%s", status, body);
    }
    return new AdminAuthException(
        errorCode,
        AuthErrorCode.fromServerCode(error.path("status").asText(null)),
        message,
        null,
        response.getStatusCode());
  }

  /**
   * Builds an error from an identity toolkit body, whose {@code error.message} starts with a
   * server code such as {@code USER_NOT_FOUND} optionally followed by {@code " : <detail>"}.
   */
  public static AdminAuthException fromIdentityToolkitResponse(
      ObjectMapper objectMapper, ResponseEntity<String> response) {
    var body = Objects.requireNonNullElse(response.getBody(), "");
    var status = response.getStatusCode().value();
    var serverMessage = readError(objectMapper, body).path("message").asText("");
    var separator = serverMessage.indexOf(':');
    var serverCode =
        separator < 0 ? serverMessage : serverMessage.substring(0, separator).trim();

    return new AdminAuthException(
        ErrorCode.fromHttpStatus(status),
        AuthErrorCode.fromServerCode(serverCode),
        String.format("http error status: %d; body: %s", status, body),
        null,
        response.getStatusCode());
  }

  private static JsonNode readError(ObjectMapper objectMapper, String body) {
    try {
      return objectMapper.readTree(body).path("error");
    } catch (IOException e) {
      // not a platform error body; the raw body is reported instead
      log.debug("error response is not JSON: {}", e.getMessage());
      return objectMapper.missingNode();
    }
  }
}
