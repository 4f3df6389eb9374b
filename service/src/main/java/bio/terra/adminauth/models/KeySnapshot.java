package bio.terra.adminauth.models;

import java.time.Instant;
import java.util.List;
import org.immutables.value.Value;

@Value.Immutable
public interface KeySnapshot {
  List<VerificationKey> getKeys();

  Instant getExpiresAt();

  default boolean isExpired(Instant now) {
    return now.isAfter(getExpiresAt());
  }

  class Builder extends ImmutableKeySnapshot.Builder {}
}
