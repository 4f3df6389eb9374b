package bio.terra.adminauth.models;

import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A verified ID token or session cookie. {@link #getUid()} always equals {@link #getSubject()};
 * {@link #getClaims()} holds every claim except iss, aud, exp, iat, sub and uid.
 */
@Value.Immutable
public interface IdToken extends WithIdToken {
  String getIssuer();

  String getAudience();

  String getSubject();

  String getUid();

  long getIssuedAt();

  long getExpires();

  long getAuthTime();

  SignInInfo getFirebase();

  Map<String, Object> getClaims();

  @Value.Derived
  default Optional<String> getTenantId() {
    return getFirebase().getTenant();
  }

  class Builder extends ImmutableIdToken.Builder {}
}
