package bio.terra.adminauth.keys;

import bio.terra.adminauth.models.VerificationKey;
import java.util.List;

/** A fixed set of keys. */
public record InMemoryKeySource(List<VerificationKey> keys) implements KeySource {
  public InMemoryKeySource {
    keys = List.copyOf(keys);
  }

  @Override
  public List<VerificationKey> getKeys() {
    return keys;
  }
}
