package bio.terra.adminauth.signing;

/** Supplies the OAuth2 bearer token sent to authenticated Google APIs. */
public interface AccessTokenProvider {
  String getAccessToken();
}
