package bio.terra.adminauth.jwt;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.JwtHeader;
import bio.terra.adminauth.signing.CryptoSigner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.util.Base64URL;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Compact JWT serialization: {@code base64url(header) "." base64url(payload) "."
 * base64url(signature)}, unpadded URL-safe base64 throughout.
 */
@Slf4j
public class JwtCodec {
  private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};
  private static final JWSHeader RS256_HEADER = new JWSHeader(JWSAlgorithm.RS256);

  private final ObjectMapper objectMapper;

  public JwtCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Serializes header and payload, has the signer sign them and appends the signature. */
  public String encode(JwtHeader header, Object payload, CryptoSigner signer) {
    var signingInput = encodeSegment(header) + "." + encodeSegment(payload);
    var signature = signer.sign(signingInput.getBytes(StandardCharsets.UTF_8));
    return signingInput + "." + Base64URL.encode(signature);
  }

  public SegmentedJwt split(String token) {
    var segments = token.split("\\.", -1);
    if (segments.length != 3) {
      throw new MalformedJwtException("incorrect number of segments");
    }
    return new SegmentedJwt(segments[0], segments[1], segments[2]);
  }

  public JwtHeader decodeHeader(SegmentedJwt jwt) {
    return decodeSegment(jwt.header(), JwtHeader.class);
  }

  public <T> T decodePayload(SegmentedJwt jwt, Class<T> payloadType) {
    return decodeSegment(jwt.payload(), payloadType);
  }

  /** The payload as a generic claim map. */
  public Map<String, Object> decodeClaims(SegmentedJwt jwt) {
    try {
      return requireValue(objectMapper.readValue(decodeBase64(jwt.payload()), CLAIMS_TYPE));
    } catch (IOException e) {
      throw new MalformedJwtException(e.getMessage(), e);
    }
  }

  /** Checks an RS256 signature over the header and payload segments. */
  public boolean verifySignature(SegmentedJwt jwt, RSAPublicKey publicKey) {
    try {
      return new RSASSAVerifier(publicKey)
          .verify(
              RS256_HEADER,
              jwt.signingInput().getBytes(StandardCharsets.UTF_8),
              new Base64URL(jwt.signature()));
    } catch (JOSEException e) {
      log.debug("signature check failed: {}", e.getMessage());
      return false;
    }
  }

  private String encodeSegment(Object value) {
    try {
      return Base64URL.encode(objectMapper.writeValueAsBytes(value)).toString();
    } catch (JsonProcessingException e) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT, "cannot serialize token segment: " + e.getMessage(), e);
    }
  }

  private <T> T decodeSegment(String segment, Class<T> type) {
    try {
      return requireValue(objectMapper.readValue(decodeBase64(segment), type));
    } catch (IOException e) {
      throw new MalformedJwtException(e.getMessage(), e);
    }
  }

  private static <T> T requireValue(@Nullable T value) {
    if (value == null) {
      throw new MalformedJwtException("token segment is not a JSON object");
    }
    return value;
  }

  private static byte[] decodeBase64(String segment) {
    try {
      return Base64.getUrlDecoder().decode(segment);
    } catch (IllegalArgumentException e) {
      throw new MalformedJwtException(e.getMessage(), e);
    }
  }
}
