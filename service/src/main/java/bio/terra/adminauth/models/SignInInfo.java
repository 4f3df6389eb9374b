package bio.terra.adminauth.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/** The {@code firebase} claim of an ID token or session cookie. */
@Value.Immutable
@JsonDeserialize(as = ImmutableSignInInfo.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface SignInInfo {
  @JsonProperty("sign_in_provider")
  @Value.Default
  default String getSignInProvider() {
    return "";
  }

  @JsonProperty("tenant")
  Optional<String> getTenant();

  @JsonProperty("identities")
  Map<String, Object> getIdentities();

  @JsonProperty("sign_in_second_factor")
  Optional<String> getSecondFactor();

  @JsonProperty("second_factor_identifier")
  Optional<String> getSecondFactorIdentifier();

  class Builder extends ImmutableSignInInfo.Builder {}
}
