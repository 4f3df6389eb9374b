package bio.terra.adminauth.keys;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.exception.AuthErrorCode;
import bio.terra.adminauth.exception.ErrorCode;
import bio.terra.adminauth.models.KeySnapshot;
import bio.terra.adminauth.models.VerificationKey;
import bio.terra.adminauth.util.AdminAuthHttpClient;
import com.google.common.annotations.VisibleForTesting;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;

/**
 * Public keys fetched from a certificate endpoint and cached for the max-age the endpoint sends in
 * its Cache-Control header.
 *
 * <p>One lock guards the cached snapshot. A caller that finds the snapshot missing or expired
 * refreshes it while holding the lock, so concurrent callers wait on a single request. If a
 * refresh fails and keys were cached before, the old keys keep being served until a refresh
 * succeeds. A cancelled refresh is always raised.
 */
@Slf4j
public class HttpKeySource implements KeySource {
  private static final String MAX_AGE_PREFIX = "max-age=";

  private final String keyUrl;
  private final AdminAuthHttpClient httpClient;
  private final PublicKeyParser publicKeyParser;
  private final Clock clock;

  // guarded by this
  private @Nullable KeySnapshot snapshot;

  public HttpKeySource(
      String keyUrl,
      AdminAuthHttpClient httpClient,
      PublicKeyParser publicKeyParser,
      Clock clock) {
    this.keyUrl = keyUrl;
    this.httpClient = httpClient;
    this.publicKeyParser = publicKeyParser;
    this.clock = clock;
  }

  @Override
  public synchronized List<VerificationKey> getKeys() {
    if (snapshot == null || snapshot.getKeys().isEmpty() || snapshot.isExpired(clock.instant())) {
      try {
        snapshot = fetchSnapshot();
        log.info("Refreshed public keys from {}; valid until {}", keyUrl, snapshot.getExpiresAt());
      } catch (AdminAuthException e) {
        if (snapshot == null
            || snapshot.getKeys().isEmpty()
            || e.getErrorCode() == ErrorCode.CANCELLED) {
          throw e;
        }
        log.warn("Serving cached public keys after a failed refresh from {}", keyUrl, e);
      }
    }
    return snapshot.getKeys();
  }

  @VisibleForTesting
  synchronized Optional<KeySnapshot> getSnapshot() {
    return Optional.ofNullable(snapshot);
  }

  private KeySnapshot fetchSnapshot() {
    ResponseEntity<String> response;
    try {
      response = httpClient.get(keyUrl, Map.of());
    } catch (AdminAuthException e) {
      throw new AdminAuthException(
          e.getErrorCode(),
          AuthErrorCode.CERTIFICATE_FETCH_FAILED,
          "failed to fetch public keys: " + e.getMessage(),
          e);
    }

    var body = Objects.requireNonNullElse(response.getBody(), "");
    if (response.getStatusCode().value() != 200) {
      throw new AdminAuthException(
          ErrorCode.fromHttpStatus(response.getStatusCode().value()),
          AuthErrorCode.CERTIFICATE_FETCH_FAILED,
          String.format(
              "invalid response (%d) while retrieving public keys: %s",
              response.getStatusCode().value(), body),
          null,
          response.getStatusCode());
    }

    var keys = publicKeyParser.parse(body.getBytes(StandardCharsets.UTF_8));
    var maxAge = findMaxAge(response.getHeaders().getCacheControl());
    return new KeySnapshot.Builder()
        .keys(keys)
        .expiresAt(clock.instant().plus(maxAge))
        .build();
  }

  /** Finds the max-age directive among the comma separated directives of a Cache-Control value. */
  @VisibleForTesting
  static Duration findMaxAge(@Nullable String cacheControl) {
    if (cacheControl != null) {
      for (var directive : cacheControl.split(",")) {
        directive = directive.trim();
        if (directive.startsWith(MAX_AGE_PREFIX)) {
          try {
            return Duration.ofSeconds(Long.parseLong(directive.substring(MAX_AGE_PREFIX.length())));
          } catch (NumberFormatException e) {
            throw PublicKeyParser.fetchFailed("invalid max-age directive: " + directive, e);
          }
        }
      }
    }
    throw PublicKeyParser.fetchFailed("Could not find expiry time from HTTP headers", null);
  }
}
