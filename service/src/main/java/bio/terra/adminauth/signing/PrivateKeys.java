package bio.terra.adminauth.signing;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import javax.annotation.Nullable;
import org.bouncycastle.util.io.pem.PemReader;

/** Parses PEM-encoded RSA private keys in PKCS#8 or PKCS#1 form. */
public final class PrivateKeys {
  private PrivateKeys() {}

  public static RSAPrivateKey parsePem(String pem) {
    byte[] content;
    try (var pemReader = new PemReader(new StringReader(pem))) {
      var pemObject = pemReader.readPemObject();
      if (pemObject == null) {
        throw invalidKey("no private key data found in PEM input", null);
      }
      content = pemObject.getContent();
    } catch (IOException e) {
      throw invalidKey("failed to read PEM input: " + e.getMessage(), e);
    }

    PrivateKey privateKey;
    try {
      var keyFactory = KeyFactory.getInstance("RSA");
      try {
        privateKey = keyFactory.generatePrivate(new PKCS8EncodedKeySpec(content));
      } catch (InvalidKeySpecException e) {
        privateKey = keyFactory.generatePrivate(pkcs1KeySpec(content));
      }
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw invalidKey(
          "private key should be a PEM or plain PKCS1 or PKCS8; parse error: " + e.getMessage(), e);
    }

    if (!(privateKey instanceof RSAPrivateKey rsaPrivateKey)) {
      throw invalidKey("private key is not an RSA key", null);
    }
    return rsaPrivateKey;
  }

  private static RSAPrivateCrtKeySpec pkcs1KeySpec(byte[] content) {
    var key = org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(content);
    return new RSAPrivateCrtKeySpec(
        key.getModulus(),
        key.getPublicExponent(),
        key.getPrivateExponent(),
        key.getPrime1(),
        key.getPrime2(),
        key.getExponent1(),
        key.getExponent2(),
        key.getCoefficient());
  }

  private static AdminAuthException invalidKey(String message, @Nullable Throwable cause) {
    return new AdminAuthException(
        ErrorCode.INVALID_ARGUMENT, AuthErrorCode.INVALID_CREDENTIAL, message, cause);
  }
}
