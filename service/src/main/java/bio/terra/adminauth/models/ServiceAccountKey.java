package bio.terra.adminauth.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Optional;
import org.immutables.value.Value;

/** The fields of a service account JSON key file used by the auth core. */
@Value.Immutable
@JsonDeserialize(as = ImmutableServiceAccountKey.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ServiceAccountKey {
  @JsonProperty("client_email")
  @Value.Default
  default String getClientEmail() {
    return "";
  }

  @Value.Redacted
  @JsonProperty("private_key")
  Optional<String> getPrivateKey();

  @JsonProperty("private_key_id")
  Optional<String> getPrivateKeyId();

  @JsonProperty("project_id")
  Optional<String> getProjectId();

  class Builder extends ImmutableServiceAccountKey.Builder {}
}
