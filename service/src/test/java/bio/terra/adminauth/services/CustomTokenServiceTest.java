package bio.terra.adminauth.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.JwtSigningTestUtils;
import bio.terra.adminauth.TestClock;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.jwt.JwtCodec;
import bio.terra.adminauth.signing.CryptoSigner;
import bio.terra.adminauth.signing.EmulatedSigner;
import bio.terra.adminauth.signing.ServiceAccountSigner;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CustomTokenServiceTest {
  private static final long NOW = 1_700_000_000L;

  private final JwtCodec jwtCodec = new JwtCodec(JwtSigningTestUtils.OBJECT_MAPPER);
  private final TestClock clock = TestClock.atEpochSecond(NOW);

  @SneakyThrows
  private CustomTokenService createService() {
    var signer =
        new ServiceAccountSigner(
            JwtSigningTestUtils.SERVICE_ACCOUNT_EMAIL,
            JwtSigningTestUtils.signingKey().toRSAPrivateKey());
    return new CustomTokenService(signer, jwtCodec, clock);
  }

  private static long longClaim(Map<String, Object> payload, String name) {
    return ((Number) payload.get(name)).longValue();
  }

  @Nested
  class Minting {

    @Test
    @SneakyThrows
    void testMintAndDecode() {
      var token = createService().createCustomToken("user1");

      var jwt = jwtCodec.split(token);
      assertEquals(
          Map.of("alg", "RS256", "typ", "JWT"), JwtSigningTestUtils.decodeSegment(jwt.header()));
      var payload = JwtSigningTestUtils.decodeSegment(jwt.payload());
      assertEquals(JwtSigningTestUtils.SERVICE_ACCOUNT_EMAIL, payload.get("iss"));
      assertEquals(JwtSigningTestUtils.SERVICE_ACCOUNT_EMAIL, payload.get("sub"));
      assertEquals(CustomTokenService.FIREBASE_AUDIENCE, payload.get("aud"));
      assertEquals("user1", payload.get("uid"));
      assertEquals(NOW, longClaim(payload, "iat"));
      assertEquals(1_700_003_600L, longClaim(payload, "exp"));
      assertFalse(payload.containsKey("claims"));
      assertFalse(payload.containsKey("tenant_id"));
      assertTrue(
          jwtCodec.verifySignature(jwt, JwtSigningTestUtils.signingKey().toRSAPublicKey()));
    }

    @Test
    void testDeveloperClaimsAndTenant() {
      var claims = new LinkedHashMap<String, Object>();
      claims.put("premium", true);
      claims.put("tier", "gold");

      var token = createService().createCustomToken("user1", claims, "tenant-1");

      var payload = JwtSigningTestUtils.decodeSegment(jwtCodec.split(token).payload());
      assertEquals(Map.of("premium", true, "tier", "gold"), payload.get("claims"));
      assertEquals("tenant-1", payload.get("tenant_id"));
    }

    @Test
    void testEmptyClaimsAreOmitted() {
      var token = createService().createCustomToken("user1", Map.of(), null);

      var payload = JwtSigningTestUtils.decodeSegment(jwtCodec.split(token).payload());
      assertFalse(payload.containsKey("claims"));
    }

    @Test
    void testEmulatedSignerToken() {
      var service = new CustomTokenService(new EmulatedSigner(), jwtCodec, clock);

      var jwt = jwtCodec.split(service.createCustomToken("user1"));

      assertEquals(
          Map.of("alg", "none", "typ", "JWT"), JwtSigningTestUtils.decodeSegment(jwt.header()));
      assertEquals(
          EmulatedSigner.EMULATOR_EMAIL,
          JwtSigningTestUtils.decodeSegment(jwt.payload()).get("iss"));
    }
  }

  @Nested
  class Validation {

    @Test
    void testUidLengthBoundary() {
      var service = createService();

      service.createCustomToken("u".repeat(128));
      for (var uid : new String[] {"", "u".repeat(129)}) {
        var error = assertThrows(AdminAuthException.class, () -> service.createCustomToken(uid));
        assertEquals(
            "uid must be non-empty, and not longer than 128 characters", error.getMessage());
        assertEquals(ErrorCode.INVALID_ARGUMENT, error.getErrorCode());
      }
    }

    @Test
    void testUidLengthCountsCodePoints() {
      var service = createService();
      var emoji = "\uD83D\uDE00";

      var payload =
          JwtSigningTestUtils.decodeSegment(
              jwtCodec.split(service.createCustomToken(emoji.repeat(128))).payload());
      assertEquals(emoji.repeat(128), payload.get("uid"));

      var error =
          assertThrows(
              AdminAuthException.class, () -> service.createCustomToken(emoji.repeat(129)));
      assertEquals(ErrorCode.INVALID_ARGUMENT, error.getErrorCode());
    }

    @Test
    void testUnserializableDeveloperClaim() {
      var service = createService();

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> service.createCustomToken("user1", Map.of("bad", new Object()), null));

      assertEquals(ErrorCode.INVALID_ARGUMENT, error.getErrorCode());
      assertTrue(error.getMessage().startsWith("cannot serialize token segment: "));
    }

    @Test
    void testEveryReservedClaimIsRejected() {
      var service = createService();

      for (var reserved : CustomTokenService.RESERVED_CLAIMS) {
        var error =
            assertThrows(
                AdminAuthException.class,
                () -> service.createCustomToken("user1", Map.of(reserved, "x"), null));
        assertEquals(
            String.format("developer claim \"%s\" is reserved and cannot be specified", reserved),
            error.getMessage());
      }
    }

    @Test
    void testMultipleReservedClaims() {
      var claims = new LinkedHashMap<String, Object>();
      claims.put("sub", "x");
      claims.put("custom", "ok");
      claims.put("aud", "x");

      var error =
          assertThrows(
              AdminAuthException.class,
              () -> createService().createCustomToken("user1", claims, null));

      assertEquals(
          "developer claims \"aud, sub\" are reserved and cannot be specified", error.getMessage());
    }

    @Test
    void testSignerEmailIsResolvedFirst() {
      var signer = mock(CryptoSigner.class);
      when(signer.getEmail())
          .thenThrow(new AdminAuthException(ErrorCode.UNKNOWN, "no service account"));
      var service = new CustomTokenService(signer, jwtCodec, clock);

      var error = assertThrows(AdminAuthException.class, () -> service.createCustomToken(""));

      assertEquals("no service account", error.getMessage());
      verify(signer, never()).sign(any());
    }
  }
}
