package bio.terra.adminauth.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Registered claims read from an incoming ID token or session cookie. Absent claims decode to
 * empty strings and zero timestamps so that the verifier, not the decoder, reports them.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTokenPayload.class)
@JsonDeserialize(as = ImmutableTokenPayload.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface TokenPayload {
  @JsonProperty("iss")
  @Value.Default
  default String getIssuer() {
    return "";
  }

  @JsonProperty("aud")
  @Value.Default
  default String getAudience() {
    return "";
  }

  @JsonProperty("sub")
  @Value.Default
  default String getSubject() {
    return "";
  }

  @JsonProperty("iat")
  @Value.Default
  default long getIssuedAt() {
    return 0;
  }

  @JsonProperty("exp")
  @Value.Default
  default long getExpires() {
    return 0;
  }

  @JsonProperty("auth_time")
  @Value.Default
  default long getAuthTime() {
    return 0;
  }

  @JsonProperty("firebase")
  @Value.Default
  default SignInInfo getFirebase() {
    return new SignInInfo.Builder().build();
  }

  class Builder extends ImmutableTokenPayload.Builder {}
}
