package bio.terra.adminauth.signing;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.common.base.Suppliers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Access tokens from Google OAuth2 credentials: the given service account key file, or application
 * default credentials when there is none. Credentials are loaded on first use.
 */
@Slf4j
public class GoogleAccessTokenProvider implements AccessTokenProvider {
  static final List<String> SCOPES =
      List.of(
          "https://www.googleapis.com/auth/cloud-platform",
          "https://www.googleapis.com/auth/firebase",
          "https://www.googleapis.com/auth/identitytoolkit",
          "https://www.googleapis.com/auth/userinfo.email");

  private final Supplier<GoogleCredentials> credentials;

  public GoogleAccessTokenProvider(@Nullable Path credentialsFile) {
    this.credentials = Suppliers.memoize(() -> loadCredentials(credentialsFile));
  }

  @Override
  public String getAccessToken() {
    var googleCredentials = credentials.get();
    try {
      googleCredentials.refreshIfExpired();
    } catch (IOException e) {
      throw new AdminAuthException(
          ErrorCode.UNAUTHENTICATED,
          AuthErrorCode.INVALID_CREDENTIAL,
          "failed to obtain an access token: " + e.getMessage(),
          e);
    }
    return googleCredentials.getAccessToken().getTokenValue();
  }

  private static GoogleCredentials loadCredentials(@Nullable Path credentialsFile) {
    try {
      if (credentialsFile == null) {
        log.info("Using application default credentials");
        return GoogleCredentials.getApplicationDefault().createScoped(SCOPES);
      }
      try (var stream = Files.newInputStream(credentialsFile)) {
        return GoogleCredentials.fromStream(stream).createScoped(SCOPES);
      }
    } catch (IOException e) {
      throw new AdminAuthException(
          ErrorCode.UNAUTHENTICATED,
          AuthErrorCode.INVALID_CREDENTIAL,
          "failed to load Google credentials: " + e.getMessage(),
          e);
    }
  }
}
