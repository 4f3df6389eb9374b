package bio.terra.adminauth.models;

import java.util.Optional;
import org.immutables.value.Value;

/** The slice of a user account the revocation check reads. */
@Value.Immutable
public interface UserRecord {
  String getUid();

  boolean isDisabled();

  long getTokensValidAfterMillis();

  Optional<String> getTenantId();

  class Builder extends ImmutableUserRecord.Builder {}
}
