package bio.terra.adminauth.services;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.jwt.JwtCodec;
import bio.terra.adminauth.jwt.MalformedJwtException;
import bio.terra.adminauth.jwt.SegmentedJwt;
import bio.terra.adminauth.keys.KeySource;
import bio.terra.adminauth.models.IdToken;
import bio.terra.adminauth.models.JwtHeader;
import bio.terra.adminauth.models.TokenPayload;
import bio.terra.adminauth.signing.CryptoSigner;
import bio.terra.adminauth.signing.EmulatedSigner;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Verifies ID tokens or session cookies issued for one project. Checks run cheapest first:
 * structure and claims, then timestamps, then the signature, which may need a key refresh.
 *
 * <p>In emulator mode tokens are unsigned: the key ID and signature are not checked and the
 * algorithm may be {@code none}.
 */
public class TokenVerifier {
  public static final long CLOCK_SKEW_SECONDS = 300;
  public static final int MAX_SUBJECT_LENGTH = 128;

  static final List<String> STANDARD_CLAIMS = List.of("iss", "aud", "exp", "iat", "sub", "uid");

  private final VerifierKind kind;
  private final @Nullable String projectId;
  private final KeySource keySource;
  private final JwtCodec jwtCodec;
  private final Clock clock;
  private final boolean emulator;

  public TokenVerifier(
      VerifierKind kind,
      @Nullable String projectId,
      KeySource keySource,
      JwtCodec jwtCodec,
      Clock clock,
      boolean emulator) {
    this.kind = kind;
    this.projectId = projectId;
    this.keySource = keySource;
    this.jwtCodec = jwtCodec;
    this.clock = clock;
    this.emulator = emulator;
  }

  public VerifierKind getKind() {
    return kind;
  }

  public boolean isEmulator() {
    return emulator;
  }

  public IdToken verify(@Nullable String token) {
    if (projectId == null || projectId.isEmpty()) {
      throw invalid("project id not available");
    }
    if (token == null || token.isEmpty()) {
      throw invalid(kind.getShortName() + " must be a non-empty string");
    }

    var jwt = splitOrInvalid(token);
    var verified = verifyContent(jwt);
    verifyTimestamps(verified);
    if (!emulator) {
      verifySignature(jwt);
    }
    return verified;
  }

  private SegmentedJwt splitOrInvalid(String token) {
    try {
      return jwtCodec.split(token);
    } catch (MalformedJwtException e) {
      throw contentError(e.getMessage(), e);
    }
  }

  private IdToken verifyContent(SegmentedJwt jwt) {
    JwtHeader header;
    TokenPayload payload;
    try {
      header = jwtCodec.decodeHeader(jwt);
      payload = jwtCodec.decodePayload(jwt, TokenPayload.class);
    } catch (MalformedJwtException e) {
      throw contentError(e.getMessage(), e);
    }

    var shortName = kind.getShortName();
    var issuer = kind.getIssuerPrefix() + projectId;
    if (!emulator && !header.hasKeyId()) {
      if (CustomTokenService.FIREBASE_AUDIENCE.equals(payload.getAudience())) {
        throw contentError(
            String.format("expected %s but got a custom token", kind.getArticledShortName()),
            null);
      }
      throw contentError(shortName + " has no 'kid' header", null);
    }
    if (!isAcceptedAlgorithm(header.getAlgorithm())) {
      throw contentError(
          String.format(
              "%s has invalid algorithm; expected 'RS256' but got \"%s\"",
              shortName, header.getAlgorithm()),
          null);
    }
    if (!Objects.equals(payload.getAudience(), projectId)) {
      throw contentError(
          String.format(
              "%s has invalid 'aud' (audience) claim; expected \"%s\" but got \"%s\"; %s",
              shortName, projectId, payload.getAudience(), projectMatchMessage()),
          null);
    }
    if (!payload.getIssuer().equals(issuer)) {
      throw contentError(
          String.format(
              "%s has invalid 'iss' (issuer) claim; expected \"%s\" but got \"%s\"; %s",
              shortName, issuer, payload.getIssuer(), projectMatchMessage()),
          null);
    }
    if (payload.getSubject().isEmpty()) {
      throw contentError(shortName + " has empty 'sub' (subject) claim", null);
    }
    var subject = payload.getSubject();
    if (subject.codePointCount(0, subject.length()) > MAX_SUBJECT_LENGTH) {
      throw contentError(
          shortName + " has a 'sub' (subject) claim longer than 128 characters", null);
    }

    return new IdToken.Builder()
        .issuer(payload.getIssuer())
        .audience(payload.getAudience())
        .subject(payload.getSubject())
        .uid(payload.getSubject())
        .issuedAt(payload.getIssuedAt())
        .expires(payload.getExpires())
        .authTime(payload.getAuthTime())
        .firebase(payload.getFirebase())
        .claims(extractClaims(jwt))
        .build();
  }

  private LinkedHashMap<String, Object> extractClaims(SegmentedJwt jwt) {
    var claims = new LinkedHashMap<String, Object>();
    try {
      jwtCodec.decodeClaims(jwt).forEach(claims::put);
    } catch (MalformedJwtException e) {
      throw contentError(e.getMessage(), e);
    }
    STANDARD_CLAIMS.forEach(claims::remove);
    // immutable maps hold no null values
    claims.values().removeIf(Objects::isNull);
    return claims;
  }

  private void verifyTimestamps(IdToken token) {
    var now = clock.instant().getEpochSecond();
    if (token.getIssuedAt() - CLOCK_SKEW_SECONDS > now) {
      throw invalid(
          String.format(
              "%s issued at future timestamp: %d", kind.getShortName(), token.getIssuedAt()));
    }
    if (token.getExpires() + CLOCK_SKEW_SECONDS < now) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT,
          kind.getExpiredCode(),
          String.format("%s has expired at: %d", kind.getShortName(), token.getExpires()));
    }
  }

  private void verifySignature(SegmentedJwt jwt) {
    var header = jwtCodec.decodeHeader(jwt);
    var keyId = header.getKeyId().filter(kid -> !kid.isEmpty());
    var verified =
        keySource.getKeys().stream()
            .filter(key -> keyId.isEmpty() || keyId.get().equals(key.getKeyId()))
            .anyMatch(key -> jwtCodec.verifySignature(jwt, key.getPublicKey()));
    if (!verified) {
      throw invalid("failed to verify token signature");
    }
  }

  private boolean isAcceptedAlgorithm(String algorithm) {
    return CryptoSigner.ALGORITHM_RS256.equals(algorithm)
        || (emulator && EmulatedSigner.ALGORITHM_NONE.equals(algorithm));
  }

  private String projectMatchMessage() {
    return String.format(
        "make sure the %s comes from the same Firebase project as the credential used to"
            + " authenticate this SDK",
        kind.getShortName());
  }

  private AdminAuthException contentError(String message, @Nullable Throwable cause) {
    return new AdminAuthException(
        ErrorCode.INVALID_ARGUMENT,
        kind.getInvalidCode(),
        String.format(
            "%s; see %s for details on how to retrieve a valid %s",
            message, kind.getDocUrl(), kind.getShortName()),
        cause);
  }

  private AdminAuthException invalid(String message) {
    return new AdminAuthException(ErrorCode.INVALID_ARGUMENT, kind.getInvalidCode(), message);
  }
}
