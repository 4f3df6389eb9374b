package bio.terra.adminauth.config;

import bio.terra.adminauth.models.ServiceAccountKey;
import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/** Settings resolved from configuration, the environment and the service account key. */
@Value.Immutable
public interface AuthContext {
  Optional<String> getProjectId();

  Optional<Path> getCredentialsFile();

  Optional<ServiceAccountKey> getServiceAccountKey();

  Optional<String> getEmulatorHost();

  default boolean isEmulator() {
    return getEmulatorHost().isPresent();
  }

  class Builder extends ImmutableAuthContext.Builder {}
}
