package bio.terra.adminauth.keys;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.VerificationKey;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.util.X509CertUtils;
import java.io.IOException;
import java.security.interfaces.RSAPublicKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Parses {@code {"<kid>": "<PEM X.509 certificate>", ...}} documents into verification keys. */
public class PublicKeyParser {
  private static final TypeReference<Map<String, String>> KEY_MAP_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public PublicKeyParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<VerificationKey> parse(byte[] document) {
    Map<String, String> certificates;
    try {
      certificates = objectMapper.readValue(document, KEY_MAP_TYPE);
    } catch (IOException e) {
      throw fetchFailed("failed to parse public keys: " + e.getMessage(), e);
    }
    if (certificates == null) {
      throw fetchFailed("failed to parse public keys: no key document", null);
    }

    var keys = new ArrayList<VerificationKey>(certificates.size());
    certificates.forEach((kid, pem) -> keys.add(parseCertificate(kid, pem)));
    return List.copyOf(keys);
  }

  private static VerificationKey parseCertificate(String kid, String pem) {
    if (kid.isEmpty()) {
      throw fetchFailed("public key document has an empty key id", null);
    }
    var certificate = X509CertUtils.parse(pem);
    if (certificate == null) {
      throw fetchFailed(String.format("failed to parse certificate for key %s", kid), null);
    }
    if (!(certificate.getPublicKey() instanceof RSAPublicKey publicKey)) {
      throw fetchFailed("Certificate is not a RSA key", null);
    }
    return new VerificationKey.Builder().keyId(kid).publicKey(publicKey).build();
  }

  static AdminAuthException fetchFailed(String message, @Nullable Throwable cause) {
    return new AdminAuthException(
        ErrorCode.UNKNOWN, AuthErrorCode.CERTIFICATE_FETCH_FAILED, message, cause);
  }
}
