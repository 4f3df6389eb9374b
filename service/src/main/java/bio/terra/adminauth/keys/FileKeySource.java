package bio.terra.adminauth.keys;

import bio.terra.adminauth.models.VerificationKey;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Public keys read from a local file on first use and kept for the life of the process. */
@Slf4j
public class FileKeySource implements KeySource {
  private final Path keyFile;
  private final PublicKeyParser publicKeyParser;

  // guarded by this
  private @Nullable List<VerificationKey> cachedKeys;

  public FileKeySource(Path keyFile, PublicKeyParser publicKeyParser) {
    this.keyFile = keyFile;
    this.publicKeyParser = publicKeyParser;
  }

  @Override
  public synchronized List<VerificationKey> getKeys() {
    if (cachedKeys == null) {
      byte[] document;
      try {
        document = Files.readAllBytes(keyFile);
      } catch (IOException e) {
        throw PublicKeyParser.fetchFailed(
            String.format("failed to read public keys from %s: %s", keyFile, e.getMessage()), e);
      }
      cachedKeys = publicKeyParser.parse(document);
      log.info("Loaded {} public keys from {}", cachedKeys.size(), keyFile);
    }
    return cachedKeys;
  }
}
