package bio.terra.adminauth.signing;

/** A fixed token. The auth emulator accepts {@link #EMULATOR_TOKEN} as an admin credential. */
public record StaticAccessTokenProvider(String token) implements AccessTokenProvider {
  public static final String EMULATOR_TOKEN = "owner";

  public static StaticAccessTokenProvider forEmulator() {
    return new StaticAccessTokenProvider(EMULATOR_TOKEN);
  }

  @Override
  public String getAccessToken() {
    return token;
  }
}
