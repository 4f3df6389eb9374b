package bio.terra.adminauth.models;

import java.security.interfaces.RSAPublicKey;
import org.immutables.value.Value;

/** An RSA public key and the key ID it is published under. */
@Value.Immutable
public interface VerificationKey {
  String getKeyId();

  RSAPublicKey getPublicKey();

  @Value.Check
  default void check() {
    if (getKeyId().isEmpty()) {
      throw new IllegalStateException("key id must not be empty");
    }
  }

  class Builder extends ImmutableVerificationKey.Builder {}
}
