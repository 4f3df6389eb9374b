package bio.terra.adminauth.config;

import bio.terra.adminauth.dataAccess.IdentityToolkitUserRecordDAO;
import bio.terra.adminauth.dataAccess.UserRecordDAO;
import bio.terra.adminauth.jwt.JwtCodec;
import bio.terra.adminauth.keys.FileKeySource;
import bio.terra.adminauth.keys.HttpKeySource;
import bio.terra.adminauth.keys.InMemoryKeySource;
import bio.terra.adminauth.keys.KeySource;
import bio.terra.adminauth.keys.PublicKeyParser;
import bio.terra.adminauth.models.ServiceAccountKey;
import bio.terra.adminauth.services.AdminAuthService;
import bio.terra.adminauth.services.TokenVerifier;
import bio.terra.adminauth.services.VerifierKind;
import bio.terra.adminauth.signing.AccessTokenProvider;
import bio.terra.adminauth.signing.CryptoSigner;
import bio.terra.adminauth.signing.EmulatedSigner;
import bio.terra.adminauth.signing.GoogleAccessTokenProvider;
import bio.terra.adminauth.signing.IamSigner;
import bio.terra.adminauth.signing.ServiceAccountKeys;
import bio.terra.adminauth.signing.StaticAccessTokenProvider;
import bio.terra.adminauth.util.AdminAuthHttpClient;
import bio.terra.adminauth.util.AdminAuthRestTemplate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.annotations.VisibleForTesting;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.core.env.Environment;
import org.springframework.core.env.PropertyResolver;

/** Spring configuration class for loading auth config and wiring the auth core. */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties
@ComponentScan(basePackageClasses = AdminAuthService.class)
public class AdminAuthSpringConfig {
  public static final String ID_TOKEN_VERIFIER = "idTokenVerifier";
  public static final String SESSION_COOKIE_VERIFIER = "sessionCookieVerifier";
  public static final String UNAUTHENTICATED_HTTP_CLIENT = "unauthenticatedHttpClient";
  public static final String AUTHENTICATED_HTTP_CLIENT = "authenticatedHttpClient";

  static final String CREDENTIALS_ENV = "GOOGLE_APPLICATION_CREDENTIALS";
  static final String EMULATOR_HOST_ENV = "FIREBASE_AUTH_EMULATOR_HOST";
  static final List<String> PROJECT_ID_ENVS = List.of("GOOGLE_CLOUD_PROJECT", "GCLOUD_PROJECT");

  @Bean
  @ConfigurationProperties(value = "adminauth", ignoreUnknownFields = false)
  public AdminAuthConfig getAdminAuthConfig() {
    return AdminAuthConfig.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AuthContext authContext(
      AdminAuthConfig adminAuthConfig, Environment environment, ObjectMapper objectMapper) {
    var authContext = resolveAuthContext(adminAuthConfig, environment, objectMapper);
    if (authContext.isEmulator()) {
      log.info("Using the auth emulator at {}", authContext.getEmulatorHost().get());
    }
    if (authContext.getProjectId().isEmpty()) {
      log.warn("No project id configured; token verification will fail");
    }
    return authContext;
  }

  @Bean
  public AdminAuthRestTemplate adminAuthRestTemplate(AdminAuthConfig adminAuthConfig) {
    return new AdminAuthRestTemplate(adminAuthConfig.getHttp());
  }

  @Bean
  public AccessTokenProvider accessTokenProvider(AuthContext authContext) {
    if (authContext.isEmulator()) {
      return StaticAccessTokenProvider.forEmulator();
    }
    return new GoogleAccessTokenProvider(authContext.getCredentialsFile().orElse(null));
  }

  @Bean(UNAUTHENTICATED_HTTP_CLIENT)
  public AdminAuthHttpClient unauthenticatedHttpClient(
      AdminAuthRestTemplate restTemplate, AdminAuthConfig adminAuthConfig) {
    return new AdminAuthHttpClient(restTemplate, adminAuthConfig.getHttp().getRetry(), null);
  }

  @Bean(AUTHENTICATED_HTTP_CLIENT)
  public AdminAuthHttpClient authenticatedHttpClient(
      AdminAuthRestTemplate restTemplate,
      AdminAuthConfig adminAuthConfig,
      AccessTokenProvider accessTokenProvider) {
    return new AdminAuthHttpClient(
        restTemplate, adminAuthConfig.getHttp().getRetry(), accessTokenProvider);
  }

  /** Token payloads decode into Immutables models backed by Guava collections. */
  @Bean
  @ConditionalOnMissingBean
  public GuavaModule guavaModule() {
    return new GuavaModule();
  }

  @Bean
  public JwtCodec jwtCodec(ObjectMapper objectMapper) {
    return new JwtCodec(objectMapper);
  }

  @Bean
  public PublicKeyParser publicKeyParser(ObjectMapper objectMapper) {
    return new PublicKeyParser(objectMapper);
  }

  @Bean
  public CryptoSigner cryptoSigner(
      AuthContext authContext,
      AdminAuthConfig adminAuthConfig,
      @Qualifier(AUTHENTICATED_HTTP_CLIENT) AdminAuthHttpClient authenticatedHttpClient,
      @Qualifier(UNAUTHENTICATED_HTTP_CLIENT) AdminAuthHttpClient unauthenticatedHttpClient,
      ObjectMapper objectMapper) {
    if (authContext.isEmulator()) {
      return new EmulatedSigner();
    }
    var localKey = authContext.getServiceAccountKey().filter(ServiceAccountKeys::canSignLocally);
    if (localKey.isPresent()) {
      log.info("Signing custom tokens as {}", localKey.get().getClientEmail());
      return ServiceAccountKeys.toSigner(localKey.get());
    }
    log.info("No service account private key; custom tokens will be signed through IAM");
    return new IamSigner(
        authenticatedHttpClient,
        unauthenticatedHttpClient,
        objectMapper,
        adminAuthConfig.getIamHost(),
        adminAuthConfig.getMetadataHost(),
        adminAuthConfig.getServiceAccountId());
  }

  @Bean(ID_TOKEN_VERIFIER)
  public TokenVerifier idTokenVerifier(
      AuthContext authContext,
      AdminAuthConfig adminAuthConfig,
      @Qualifier(UNAUTHENTICATED_HTTP_CLIENT) AdminAuthHttpClient httpClient,
      PublicKeyParser publicKeyParser,
      JwtCodec jwtCodec,
      Clock clock) {
    var keySource =
        keySource(
            authContext,
            adminAuthConfig,
            adminAuthConfig.getIdTokenCertUrl(),
            httpClient,
            publicKeyParser,
            clock);
    return new TokenVerifier(
        VerifierKind.ID_TOKEN,
        authContext.getProjectId().orElse(null),
        keySource,
        jwtCodec,
        clock,
        authContext.isEmulator());
  }

  @Bean(SESSION_COOKIE_VERIFIER)
  public TokenVerifier sessionCookieVerifier(
      AuthContext authContext,
      AdminAuthConfig adminAuthConfig,
      @Qualifier(UNAUTHENTICATED_HTTP_CLIENT) AdminAuthHttpClient httpClient,
      PublicKeyParser publicKeyParser,
      JwtCodec jwtCodec,
      Clock clock) {
    var keySource =
        keySource(
            authContext,
            adminAuthConfig,
            adminAuthConfig.getSessionCookieCertUrl(),
            httpClient,
            publicKeyParser,
            clock);
    return new TokenVerifier(
        VerifierKind.SESSION_COOKIE,
        authContext.getProjectId().orElse(null),
        keySource,
        jwtCodec,
        clock,
        authContext.isEmulator());
  }

  @Bean
  @ConditionalOnMissingBean
  public UserRecordDAO userRecordDAO(
      AuthContext authContext,
      AdminAuthConfig adminAuthConfig,
      @Qualifier(AUTHENTICATED_HTTP_CLIENT) AdminAuthHttpClient httpClient,
      ObjectMapper objectMapper) {
    var host =
        authContext
            .getEmulatorHost()
            .map(emulatorHost -> "http://" + emulatorHost + "/identitytoolkit.googleapis.com")
            .orElse(adminAuthConfig.getIdentityToolkitHost());
    return new IdentityToolkitUserRecordDAO(
        httpClient, objectMapper, host, authContext.getProjectId().orElse(null));
  }

  private static KeySource keySource(
      AuthContext authContext,
      AdminAuthConfig adminAuthConfig,
      String certUrl,
      AdminAuthHttpClient httpClient,
      PublicKeyParser publicKeyParser,
      Clock clock) {
    if (authContext.isEmulator()) {
      // emulator tokens are unsigned
      return new InMemoryKeySource(List.of());
    }
    if (adminAuthConfig.getPublicKeysFile() != null) {
      return new FileKeySource(Path.of(adminAuthConfig.getPublicKeysFile()), publicKeyParser);
    }
    return new HttpKeySource(certUrl, httpClient, publicKeyParser, clock);
  }

  /**
   * Resolves the credentials file, project id and emulator host. Each configured property wins
   * over its environment variable; the project id also falls back to the service account key.
   */
  @VisibleForTesting
  static AuthContext resolveAuthContext(
      AdminAuthConfig adminAuthConfig, PropertyResolver environment, ObjectMapper objectMapper) {
    var credentialsFile =
        nonEmpty(adminAuthConfig.getCredentialsFile())
            .or(() -> nonEmpty(environment.getProperty(CREDENTIALS_ENV)))
            .map(Path::of);
    var serviceAccountKey =
        credentialsFile.map(keyFile -> ServiceAccountKeys.load(objectMapper, keyFile));

    var projectId =
        nonEmpty(adminAuthConfig.getProjectId())
            .or(() -> serviceAccountKey.flatMap(ServiceAccountKey::getProjectId))
            .or(
                () ->
                    PROJECT_ID_ENVS.stream()
                        .map(environment::getProperty)
                        .flatMap(value -> nonEmpty(value).stream())
                        .findFirst());

    return new AuthContext.Builder()
        .projectId(projectId.filter(id -> !id.isEmpty()))
        .credentialsFile(credentialsFile)
        .serviceAccountKey(serviceAccountKey)
        .emulatorHost(
            nonEmpty(adminAuthConfig.getEmulatorHost())
                .or(() -> nonEmpty(environment.getProperty(EMULATOR_HOST_ENV))))
        .build();
  }

  private static Optional<String> nonEmpty(@Nullable String value) {
    return Optional.ofNullable(value).filter(v -> !v.isEmpty());
  }
}
