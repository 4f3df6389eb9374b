package bio.terra.adminauth.config;

import java.time.Duration;
import org.immutables.value.Value;

/** Backoff for 500/503 responses and I/O failures. The multiplier is fixed at 2. */
@Value.Modifiable
@PropertiesInterfaceStyle
public interface RetryConfigurationInterface {
  @Value.Default
  default int getMaxAttempts() {
    return 4;
  }

  @Value.Default
  default Duration getInitialInterval() {
    return Duration.ofMillis(500);
  }

  @Value.Default
  default Duration getMaxInterval() {
    return Duration.ofSeconds(30);
  }
}
