package bio.terra.adminauth.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableJwtHeader.class)
@JsonDeserialize(as = ImmutableJwtHeader.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public interface JwtHeader {
  String TYPE_JWT = "JWT";

  @JsonProperty("alg")
  @Value.Default
  default String getAlgorithm() {
    return "";
  }

  @JsonProperty("typ")
  Optional<String> getType();

  @JsonProperty("kid")
  Optional<String> getKeyId();

  /** True when the header names a non-empty key ID. */
  default boolean hasKeyId() {
    return getKeyId().filter(kid -> !kid.isEmpty()).isPresent();
  }

  class Builder extends ImmutableJwtHeader.Builder {}
}
