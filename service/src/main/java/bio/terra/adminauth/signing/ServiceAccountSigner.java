package bio.terra.adminauth.signing;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import java.security.interfaces.RSAPrivateKey;
import javax.annotation.Nullable;

/** RS256 signatures computed locally with a service account private key. */
public class ServiceAccountSigner implements CryptoSigner {
  private static final JWSHeader RS256_HEADER = new JWSHeader(JWSAlgorithm.RS256);

  private final String email;
  private final @Nullable RSASSASigner signer;

  public ServiceAccountSigner(String email, @Nullable RSAPrivateKey privateKey) {
    this.email = email;
    this.signer = privateKey == null ? null : new RSASSASigner(privateKey);
  }

  @Override
  public String getAlgorithm() {
    return ALGORITHM_RS256;
  }

  @Override
  public byte[] sign(byte[] payload) {
    if (signer == null) {
      throw new AdminAuthException(
          ErrorCode.FAILED_PRECONDITION,
          AuthErrorCode.INVALID_CREDENTIAL,
          "private key not available");
    }
    try {
      return signer.sign(RS256_HEADER, payload).decode();
    } catch (JOSEException e) {
      throw new AdminAuthException(
          ErrorCode.INTERNAL,
          AuthErrorCode.INVALID_CREDENTIAL,
          "failed to sign with the service account private key: " + e.getMessage(),
          e);
    }
  }

  @Override
  public String getEmail() {
    if (email.isEmpty()) {
      throw new AdminAuthException(
          ErrorCode.FAILED_PRECONDITION,
          AuthErrorCode.INVALID_CREDENTIAL,
          "service account email not available");
    }
    return email;
  }
}
