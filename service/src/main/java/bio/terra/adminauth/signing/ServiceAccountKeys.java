package bio.terra.adminauth.signing;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.ServiceAccountKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Reads service account JSON key files. */
@Slf4j
public final class ServiceAccountKeys {
  private ServiceAccountKeys() {}

  public static ServiceAccountKey load(ObjectMapper objectMapper, Path keyFile) {
    try {
      var key = objectMapper.readValue(keyFile.toFile(), ServiceAccountKey.class);
      log.info("Loaded service account key for {} from {}", key.getClientEmail(), keyFile);
      return key;
    } catch (IOException e) {
      throw new AdminAuthException(
          ErrorCode.INVALID_ARGUMENT,
          AuthErrorCode.INVALID_CREDENTIAL,
          String.format("failed to read service account key %s: %s", keyFile, e.getMessage()),
          e);
    }
  }

  /**
   * A local signer when the key carries both an email and a private key. Otherwise signing has to
   * go through IAM.
   */
  public static boolean canSignLocally(ServiceAccountKey key) {
    return !key.getClientEmail().isEmpty()
        && key.getPrivateKey().filter(pk -> !pk.isEmpty()).isPresent();
  }

  public static ServiceAccountSigner toSigner(ServiceAccountKey key) {
    var privateKey =
        key.getPrivateKey()
            .filter(pk -> !pk.isEmpty())
            .map(PrivateKeys::parsePem)
            .orElse(null);
    return new ServiceAccountSigner(key.getClientEmail(), privateKey);
  }
}
