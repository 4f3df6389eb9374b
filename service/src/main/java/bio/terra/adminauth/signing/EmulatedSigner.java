package bio.terra.adminauth.signing;

import java.nio.charset.StandardCharsets;

/** Placeholder signatures for the auth emulator, which does not check them. */
public class EmulatedSigner implements CryptoSigner {
  public static final String ALGORITHM_NONE = "none";
  public static final String EMULATOR_EMAIL = "firebase-auth-emulator@example.com";

  private static final byte[] SIGNATURE = "signature".getBytes(StandardCharsets.UTF_8);

  @Override
  public String getAlgorithm() {
    return ALGORITHM_NONE;
  }

  @Override
  public byte[] sign(byte[] payload) {
    return SIGNATURE.clone();
  }

  @Override
  public String getEmail() {
    return EMULATOR_EMAIL;
  }
}
