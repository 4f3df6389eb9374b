package bio.terra.adminauth.config;

import java.time.Duration;
import org.immutables.value.Value;

@Value.Modifiable
@PropertiesInterfaceStyle
public interface HttpConfigurationInterface {
  @Value.Default
  default Duration getConnectTimeout() {
    return Duration.ofSeconds(10);
  }

  @Value.Default
  default Duration getReadTimeout() {
    return Duration.ofSeconds(30);
  }

  @Value.Default
  default RetryConfiguration getRetry() {
    return RetryConfiguration.create();
  }
}
