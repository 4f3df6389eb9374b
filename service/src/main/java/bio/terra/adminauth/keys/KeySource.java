package bio.terra.adminauth.keys;

import bio.terra.adminauth.models.VerificationKey;
import java.util.List;

/** A source of the public keys trusted to have signed incoming tokens. */
public interface KeySource {

  /**
   * The currently trusted keys, refreshing them first if the source caches them and the cache has
   * expired.
   *
   * @throws bio.terra.adminauth.AdminAuthException with {@code CERTIFICATE_FETCH_FAILED} when no
   *     keys can be produced
   */
  List<VerificationKey> getKeys();
}
