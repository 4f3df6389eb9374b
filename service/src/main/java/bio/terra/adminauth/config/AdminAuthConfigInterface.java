package bio.terra.adminauth.config;

import javax.annotation.Nullable;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface AdminAuthConfigInterface {
  String DEFAULT_ID_TOKEN_CERT_URL =
      "https://www.googleapis.com/robot/v1/metadata/x509/securetoken@system.gserviceaccount.com";
  String DEFAULT_SESSION_COOKIE_CERT_URL =
      "https://www.googleapis.com/identitytoolkit/v3/relyingparty/publicKeys";

  // Nullable to make the generated class play nicely with spring: spring calls the getter before
  // the setter, and the generated code errors on an unset mandatory attribute.
  @Nullable
  String getProjectId();

  /** Signer email for remote signing; discovered from the metadata server when absent. */
  @Nullable
  String getServiceAccountId();

  /** Service account JSON key file. Falls back to GOOGLE_APPLICATION_CREDENTIALS. */
  @Nullable
  String getCredentialsFile();

  /** host:port of the auth emulator. Falls back to FIREBASE_AUTH_EMULATOR_HOST. */
  @Nullable
  String getEmulatorHost();

  /** When set, both verifiers read their public certificates from this file. */
  @Nullable
  String getPublicKeysFile();

  @Value.Default
  default String getIdTokenCertUrl() {
    return DEFAULT_ID_TOKEN_CERT_URL;
  }

  @Value.Default
  default String getSessionCookieCertUrl() {
    return DEFAULT_SESSION_COOKIE_CERT_URL;
  }

  @Value.Default
  default String getIamHost() {
    return "https://iam.googleapis.com";
  }

  @Value.Default
  default String getMetadataHost() {
    return "http://metadata";
  }

  @Value.Default
  default String getIdentityToolkitHost() {
    return "https://identitytoolkit.googleapis.com";
  }

  @Value.Default
  default HttpConfiguration getHttp() {
    return HttpConfiguration.create();
  }
}
