package bio.terra.adminauth.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import bio.terra.adminauth.JwtSigningTestUtils;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class PlatformErrorsTest {

  @Nested
  class PlatformResponses {

    @Test
    void testStatusOverridesHttpCategory() {
      var response =
          ResponseEntity.status(HttpStatus.BAD_REQUEST)
              .body("{\"error\": {\"status\": \"NOT_FOUND\", \"message\": \"no such account\"}}");

      var error = PlatformErrors.fromPlatformResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(ErrorCode.NOT_FOUND, error.getErrorCode());
      assertEquals("no such account", error.getMessage());
      assertEquals(AuthErrorCode.UNKNOWN, error.getAuthErrorCode().orElseThrow());
      assertEquals(HttpStatus.BAD_REQUEST, error.getHttpStatus().orElseThrow());
    }

    @Test
    void testHttpCategoryWithoutErrorBody() {
      var response = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body("slow down");

      var error = PlatformErrors.fromPlatformResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(ErrorCode.RESOURCE_EXHAUSTED, error.getErrorCode());
      assertEquals("unexpected http response with status: 429\nslow down", error.getMessage());
    }

    @Test
    void testUnmappedStatus() {
      var response = ResponseEntity.status(HttpStatus.I_AM_A_TEAPOT).body("{}");

      var error = PlatformErrors.fromPlatformResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(ErrorCode.UNKNOWN, error.getErrorCode());
      assertEquals("unexpected http response with status: 418\n{}", error.getMessage());
    }
  }

  @Nested
  class IdentityToolkitResponses {

    @Test
    void testServerCodeWithDetail() {
      var body = "{\"error\": {\"message\": \"USER_NOT_FOUND : no user record\"}}";
      var response = ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);

      var error =
          PlatformErrors.fromIdentityToolkitResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(AuthErrorCode.USER_NOT_FOUND, error.getAuthErrorCode().orElseThrow());
      assertEquals(ErrorCode.INVALID_ARGUMENT, error.getErrorCode());
      assertEquals("http error status: 400; body: " + body, error.getMessage());
    }

    @Test
    void testPermissionDenied() {
      var body = "{\"error\": {\"message\": \"INSUFFICIENT_PERMISSION\"}}";
      var response = ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);

      var error =
          PlatformErrors.fromIdentityToolkitResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(AuthErrorCode.INSUFFICIENT_PERMISSION, error.getAuthErrorCode().orElseThrow());
      assertEquals(ErrorCode.PERMISSION_DENIED, error.getErrorCode());
    }

    @Test
    void testNonJsonBody() {
      var response = ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("<html>");

      var error =
          PlatformErrors.fromIdentityToolkitResponse(JwtSigningTestUtils.OBJECT_MAPPER, response);

      assertEquals(AuthErrorCode.UNKNOWN, error.getAuthErrorCode().orElseThrow());
      assertEquals(ErrorCode.UNAVAILABLE, error.getErrorCode());
      assertEquals("http error status: 503; body: <html>", error.getMessage());
    }
  }
}
