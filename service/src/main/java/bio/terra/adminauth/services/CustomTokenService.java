package bio.terra.adminauth.services;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.jwt.JwtCodec;
import bio.terra.adminauth.models.CustomTokenPayload;
import bio.terra.adminauth.models.JwtHeader;
import bio.terra.adminauth.signing.CryptoSigner;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Mints custom tokens that client apps exchange for an ID token. */
@Slf4j
@Service
public class CustomTokenService {
  public static final String FIREBASE_AUDIENCE =
      "https://identitytoolkit.googleapis.com/google.identity.identitytoolkit.v1.IdentityToolkit";
  public static final long TOKEN_TTL_SECONDS = 3600;
  /** Counted in Unicode code points. */
  public static final int MAX_UID_LENGTH = 128;

  /** Claims owned by the platform; developer claims may not use them. */
  public static final List<String> RESERVED_CLAIMS =
      List.of(
          "acr", "amr", "at_hash", "aud", "auth_time", "azp", "cnf", "c_hash", "exp", "firebase",
          "iat", "iss", "jti", "nbf", "nonce", "sub");

  private final CryptoSigner signer;
  private final JwtCodec jwtCodec;
  private final Clock clock;

  public CustomTokenService(CryptoSigner signer, JwtCodec jwtCodec, Clock clock) {
    this.signer = signer;
    this.jwtCodec = jwtCodec;
    this.clock = clock;
  }

  public String createCustomToken(String uid) {
    return createCustomToken(uid, null, null);
  }

  public String createCustomToken(
      String uid, @Nullable Map<String, Object> developerClaims, @Nullable String tenantId) {
    var email = signer.getEmail();

    if (uid == null || uid.isEmpty() || uid.codePointCount(0, uid.length()) > MAX_UID_LENGTH) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT, "uid must be non-empty, and not longer than 128 characters");
    }

    var claims = developerClaims == null ? Map.<String, Object>of() : developerClaims;
    var disallowed = RESERVED_CLAIMS.stream().filter(claims::containsKey).toList();
    if (disallowed.size() == 1) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT,
          String.format(
              "developer claim \"%s\" is reserved and cannot be specified", disallowed.get(0)));
    } else if (disallowed.size() > 1) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT,
          String.format(
              "developer claims \"%s\" are reserved and cannot be specified",
              String.join(", ", disallowed)));
    }

    Optional<Map<String, Object>> payloadClaims =
        claims.isEmpty()
            ? Optional.empty()
            : Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(claims)));
    var now = clock.instant().getEpochSecond();
    var payload =
        new CustomTokenPayload.Builder()
            .issuer(email)
            .subject(email)
            .audience(FIREBASE_AUDIENCE)
            .issuedAt(now)
            .expires(now + TOKEN_TTL_SECONDS)
            .uid(uid)
            .claims(payloadClaims)
            .tenantId(Optional.ofNullable(tenantId))
            .build();
    var header =
        new JwtHeader.Builder().algorithm(signer.getAlgorithm()).type(JwtHeader.TYPE_JWT).build();

    log.debug("Minting custom token for uid {}", uid);
    return jwtCodec.encode(header, payload, signer);
  }
}
