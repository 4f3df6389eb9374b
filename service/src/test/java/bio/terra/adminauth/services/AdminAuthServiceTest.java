package bio.terra.adminauth.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.BaseTest;
import bio.terra.adminauth.JwtSigningTestUtils;
import bio.terra.adminauth.TestAdminAuthApplication;
import bio.terra.adminauth.TestClock;
import bio.terra.adminauth.dataAccess.UserRecordDAO;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.AuthErrors;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.jwt.JwtCodec;
import bio.terra.adminauth.models.UserRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

class AdminAuthServiceTest extends BaseTest {
  private static final long NOW = TestAdminAuthApplication.NOW_EPOCH_SECOND;
  private static final String UID = JwtSigningTestUtils.TEST_UID;

  @Autowired private AdminAuthService adminAuthService;
  @Autowired private JwtCodec jwtCodec;
  @Autowired private TestClock clock;

  @MockBean private UserRecordDAO userRecordDAO;

  @BeforeEach
  void resetClock() {
    clock.setInstant(Instant.ofEpochSecond(NOW));
  }

  private static String idToken(long issuedAt) {
    return token(VerifierKind.ID_TOKEN, issuedAt, null);
  }

  private static String token(VerifierKind kind, long issuedAt, @Nullable String tenantId) {
    var claims = JwtSigningTestUtils.validClaims(kind, issuedAt);
    if (tenantId != null) {
      claims.put("firebase", Map.of("sign_in_provider", "custom", "tenant", tenantId));
    }
    return JwtSigningTestUtils.createToken(
        JwtSigningTestUtils.header(JwtSigningTestUtils.KEY_ID), claims);
  }

  private void givenUser(@Nullable String tenantId, boolean disabled, long validAfterMillis) {
    when(userRecordDAO.getUser(tenantId, UID))
        .thenReturn(
            new UserRecord.Builder()
                .uid(UID)
                .isDisabled(disabled)
                .tokensValidAfterMillis(validAfterMillis)
                .build());
  }

  @Nested
  class CustomTokens {

    @Test
    void testCreateCustomToken() {
      var token = adminAuthService.createCustomToken("user1");

      var jwt = jwtCodec.split(token);
      var payload = JwtSigningTestUtils.decodeSegment(jwt.payload());
      assertEquals(JwtSigningTestUtils.SERVICE_ACCOUNT_EMAIL, payload.get("iss"));
      assertEquals("user1", payload.get("uid"));
      assertEquals(NOW, ((Number) payload.get("iat")).longValue());
    }

    @Test
    void testCreateCustomTokenWithClaims() {
      var token = adminAuthService.createCustomTokenWithClaims("user1", Map.of("premium", true));

      var payload = JwtSigningTestUtils.decodeSegment(jwtCodec.split(token).payload());
      assertEquals(Map.of("premium", true), payload.get("claims"));
    }

    @Test
    void testCustomTokenIsNotAnIdToken() {
      var customToken = adminAuthService.createCustomToken("user1");

      var error =
          assertThrows(AdminAuthException.class, () -> adminAuthService.verifyIdToken(customToken));

      assertTrue(error.getMessage().startsWith("expected an ID token but got a custom token"));
    }
  }

  @Nested
  class Verification {

    @Test
    void testVerifyIdTokenSkipsUserLookup() {
      var verified = adminAuthService.verifyIdToken(idToken(NOW));

      assertEquals(UID, verified.getUid());
      verify(userRecordDAO, never()).getUser(any(), any());
    }

    @Test
    void testVerifyIdTokenWithSignInIdentities() {
      var claims = JwtSigningTestUtils.validClaims(VerifierKind.ID_TOKEN, NOW);
      claims.put(
          "firebase",
          Map.of(
              "sign_in_provider",
              "password",
              "identities",
              Map.of("email", List.of("alice@example.com"))));
      var token =
          JwtSigningTestUtils.createToken(
              JwtSigningTestUtils.header(JwtSigningTestUtils.KEY_ID), claims);

      var verified = adminAuthService.verifyIdToken(token);

      assertEquals("password", verified.getFirebase().getSignInProvider());
      assertEquals(
          Map.of("email", List.of("alice@example.com")), verified.getFirebase().getIdentities());
    }

    @Test
    void testVerifyIdTokenAndCheckRevoked() {
      givenUser(null, false, (NOW - 10) * 1000);

      var verified = adminAuthService.verifyIdTokenAndCheckRevoked(idToken(NOW));

      assertEquals(UID, verified.getUid());
    }

    @Test
    void testRevokedIdToken() {
      clock.setInstant(Instant.ofEpochSecond(100));
      givenUser(null, false, 1_000_000);

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.verifyIdTokenAndCheckRevoked(idToken(0)));

      assertEquals("ID token has been revoked", error.getMessage());
      assertTrue(AuthErrors.isIdTokenRevoked(error));
      assertTrue(AuthErrors.isIdTokenInvalid(error));
    }

    @Test
    void testDisabledUser() {
      clock.setInstant(Instant.ofEpochSecond(100));
      givenUser(null, true, 0);

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.verifyIdTokenAndCheckRevoked(idToken(0)));

      assertEquals("user has been disabled", error.getMessage());
      assertTrue(AuthErrors.isUserDisabled(error));
    }

    @Test
    void testRevokedSessionCookie() {
      givenUser(null, false, (NOW + 1) * 1000);
      var cookie = token(VerifierKind.SESSION_COOKIE, NOW, null);

      assertEquals(UID, adminAuthService.verifySessionCookie(cookie).getUid());
      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.verifySessionCookieAndCheckRevoked(cookie));

      assertEquals("session cookie has been revoked", error.getMessage());
      assertTrue(AuthErrors.isSessionCookieRevoked(error));
    }

    @Test
    void testInvalidTokenSkipsUserLookup() {
      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.verifyIdTokenAndCheckRevoked(idToken(NOW - 10_000)));

      assertTrue(AuthErrors.isIdTokenExpired(error));
      verify(userRecordDAO, never()).getUser(any(), any());
    }

    @Test
    void testUserNotFoundSurfacesUnchanged() {
      var notFound =
          new AdminAuthException(
              ErrorCode.NOT_FOUND,
              AuthErrorCode.USER_NOT_FOUND,
              "cannot find user from uid: \"" + UID + "\"");
      when(userRecordDAO.getUser(null, UID)).thenThrow(notFound);

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.verifyIdTokenAndCheckRevoked(idToken(NOW)));

      assertSame(notFound, error);
    }
  }

  @Nested
  class Tenants {

    @Test
    void testEmptyTenantId() {
      var error = assertThrows(AdminAuthException.class, () -> adminAuthService.forTenant(""));

      assertEquals("tenantID must not be empty", error.getMessage());
    }

    @Test
    void testTenantCustomToken() {
      var tenantAuth = adminAuthService.forTenant("tenant-1");

      var token = tenantAuth.createCustomToken("user1");

      assertEquals("tenant-1", tenantAuth.getTenantId());
      var payload = JwtSigningTestUtils.decodeSegment(jwtCodec.split(token).payload());
      assertEquals("tenant-1", payload.get("tenant_id"));
    }

    @Test
    void testTenantTokenIsCheckedAgainstTenant() {
      givenUser("tenant-1", false, 0);
      var tenantAuth = adminAuthService.forTenant("tenant-1");
      var token = token(VerifierKind.ID_TOKEN, NOW, "tenant-1");

      assertEquals(UID, tenantAuth.verifyIdTokenAndCheckRevoked(token).getUid());
      verify(userRecordDAO).getUser("tenant-1", UID);
    }

    @Test
    void testTenantMismatch() {
      var token = token(VerifierKind.ID_TOKEN, NOW, "tenant-2");

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> adminAuthService.forTenant("tenant-1").verifyIdToken(token));

      assertEquals("invalid tenant id: \"tenant-2\"", error.getMessage());
      assertTrue(AuthErrors.isTenantIdMismatch(error));
    }

    @Test
    void testProjectTokenIsNotATenantToken() {
      var tenantAuth = adminAuthService.forTenant("tenant-1");
      var cookie = token(VerifierKind.SESSION_COOKIE, NOW, null);

      var error =
          assertThrows(AdminAuthException.class, () -> tenantAuth.verifySessionCookie(cookie));

      assertEquals("invalid tenant id: \"\"", error.getMessage());
    }
  }
}
