package bio.terra.adminauth.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** Claims of a minted custom token, in wire order. */
@Value.Immutable
@JsonSerialize(as = ImmutableCustomTokenPayload.class)
@JsonDeserialize(as = ImmutableCustomTokenPayload.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public interface CustomTokenPayload {
  @JsonProperty("iss")
  String getIssuer();

  @JsonProperty("sub")
  String getSubject();

  @JsonProperty("aud")
  String getAudience();

  @JsonProperty("iat")
  long getIssuedAt();

  @JsonProperty("exp")
  long getExpires();

  @JsonProperty("uid")
  String getUid();

  // developer claim values may be null, so the map is held as given
  @JsonProperty("claims")
  Optional<Map<String, Object>> getClaims();

  @JsonProperty("tenant_id")
  Optional<String> getTenantId();

  class Builder extends ImmutableCustomTokenPayload.Builder {}
}
