package bio.terra.adminauth.dataAccess;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.UserRecord;
import bio.terra.adminauth.util.AdminAuthHttpClient;
import bio.terra.adminauth.util.PlatformErrors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Looks users up through the identity toolkit {@code accounts:lookup} API. */
@Slf4j
public class IdentityToolkitUserRecordDAO implements UserRecordDAO {
  private final AdminAuthHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String identityToolkitHost;
  private final @Nullable String projectId;

  public IdentityToolkitUserRecordDAO(
      AdminAuthHttpClient httpClient,
      ObjectMapper objectMapper,
      String identityToolkitHost,
      @Nullable String projectId) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.identityToolkitHost = identityToolkitHost;
    this.projectId = projectId;
  }

  @Override
  public UserRecord getUser(@Nullable String tenantId, String uid) {
    if (projectId == null || projectId.isEmpty()) {
      throw new AdminAuthException(ErrorCode.FAILED_PRECONDITION, "project id not available");
    }
    var url = new StringBuilder(identityToolkitHost).append("/v1/projects/").append(projectId);
    if (tenantId != null) {
      url.append("/tenants/").append(tenantId);
    }
    url.append("/accounts:lookup");

    var response = httpClient.postJson(url.toString(), Map.of("localId", List.of(uid)));
    if (!response.getStatusCode().is2xxSuccessful()) {
      throw PlatformErrors.fromIdentityToolkitResponse(objectMapper, response);
    }

    var users = readBody(response.getBody()).path("users");
    if (!users.isArray() || users.isEmpty()) {
      throw new AdminAuthException(
          ErrorCode.NOT_FOUND,
          AuthErrorCode.USER_NOT_FOUND,
          String.format("cannot find user from uid: \"%s\"", uid));
    }

    var user = users.get(0);
    return new UserRecord.Builder()
        .uid(user.path("localId").asText(uid))
        .isDisabled(user.path("disabled").asBoolean(false))
        // validSince is in seconds, sent as a string
        .tokensValidAfterMillis(user.path("validSince").asLong(0) * 1000)
        .tenantId(Optional.ofNullable(user.path("tenantId").textValue()))
        .build();
  }

  private JsonNode readBody(@Nullable String body) {
    try {
      return objectMapper.readTree(Objects.requireNonNullElse(body, ""));
    } catch (JsonProcessingException e) {
      throw new AdminAuthException(
          ErrorCode.UNKNOWN, "error while parsing response: " + e.getMessage(), e);
    }
  }
}
