package bio.terra.adminauth.signing;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.util.AdminAuthHttpClient;
import bio.terra.adminauth.util.PlatformErrors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;

/**
 * Signs through the IAM signBlob API as a service account that the caller's credentials may act
 * as. The service account is the configured one, or else the default account of the compute
 * instance, discovered once from the metadata server.
 */
@Slf4j
public class IamSigner implements CryptoSigner {
  @VisibleForTesting
  static final String METADATA_EMAIL_PATH =
      "/computeMetadata/v1/instance/service-accounts/default/email";

  private static final String DISCOVERY_GUIDANCE =
      "initialize the SDK with service account credentials or specify a service account with"
          + " iam.serviceAccounts.signBlob permission; refer to"
          + " https://firebase.google.com/docs/auth/admin/create-custom-tokens for more details on"
          + " creating custom tokens";

  private final AdminAuthHttpClient iamClient;
  private final AdminAuthHttpClient metadataClient;
  private final ObjectMapper objectMapper;
  private final String iamHost;
  private final String metadataHost;

  // guarded by this
  private @Nullable String serviceAccountId;

  public IamSigner(
      AdminAuthHttpClient iamClient,
      AdminAuthHttpClient metadataClient,
      ObjectMapper objectMapper,
      String iamHost,
      String metadataHost,
      @Nullable String serviceAccountId) {
    this.iamClient = iamClient;
    this.metadataClient = metadataClient;
    this.objectMapper = objectMapper;
    this.iamHost = iamHost;
    this.metadataHost = metadataHost;
    this.serviceAccountId =
        serviceAccountId == null || serviceAccountId.isEmpty() ? null : serviceAccountId;
  }

  @Override
  public String getAlgorithm() {
    return ALGORITHM_RS256;
  }

  @Override
  public byte[] sign(byte[] payload) {
    var email = getEmail();
    var url = String.format("%s/v1/projects/-/serviceAccounts/%s:signBlob", iamHost, email);
    var response =
        iamClient.postJson(url, Map.of("bytesToSign", Base64.getEncoder().encodeToString(payload)));
    if (!response.getStatusCode().is2xxSuccessful()) {
      var error = PlatformErrors.fromPlatformResponse(objectMapper, response);
      log.warn("signBlob as {} failed: {}", email, error.getMessage());
      throw error;
    }
    var signature = readField(response, "signature");
    try {
      return Base64.getDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      throw new AdminAuthException(
          ErrorCode.UNKNOWN, "error while parsing signBlob response: " + e.getMessage(), e);
    }
  }

  @Override
  public synchronized String getEmail() {
    if (serviceAccountId == null) {
      try {
        serviceAccountId = discoverServiceAccount();
      } catch (AdminAuthException e) {
        throw new AdminAuthException(
            e.getErrorCode(),
            String.format(
                "failed to determine service account: %s; %s", e.getMessage(), DISCOVERY_GUIDANCE),
            e);
      }
      log.info("Discovered service account {} from the metadata server", serviceAccountId);
    }
    return serviceAccountId;
  }

  private String discoverServiceAccount() {
    var response =
        metadataClient.get(metadataHost + METADATA_EMAIL_PATH, Map.of("Metadata-Flavor", "Google"));
    if (!response.getStatusCode().is2xxSuccessful()) {
      throw PlatformErrors.fromPlatformResponse(objectMapper, response);
    }
    var body = response.getBody();
    if (body == null || body.isBlank()) {
      throw new AdminAuthException(ErrorCode.UNKNOWN, "unexpected response from metadata service");
    }
    return body.trim();
  }

  private String readField(ResponseEntity<String> response, String field) {
    try {
      var body = Objects.requireNonNullElse(response.getBody(), "");
      var value = objectMapper.readTree(body).path(field).asText("");
      if (value.isEmpty()) {
        throw new AdminAuthException(
            ErrorCode.UNKNOWN, "signBlob response has no " + field + ": " + body);
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new AdminAuthException(
          ErrorCode.UNKNOWN, "error while parsing signBlob response: " + e.getMessage(), e);
    }
  }
}
