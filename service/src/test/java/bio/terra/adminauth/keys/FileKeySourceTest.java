package bio.terra.adminauth.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import bio.terra.adminauth.AdminAuthException;
import bio.terra.adminauth.JwtSigningTestUtils;
import bio.terra.adminauth.exception.AuthErrors;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileKeySourceTest {
  private final PublicKeyParser parser = new PublicKeyParser(JwtSigningTestUtils.OBJECT_MAPPER);

  @TempDir Path tempDir;

  @Test
  void testKeysAreReadOnce() throws IOException {
    var keyFile = tempDir.resolve("keys.json");
    Files.writeString(
        keyFile, JwtSigningTestUtils.publicKeysJson(JwtSigningTestUtils.signingKey()));
    var keySource = new FileKeySource(keyFile, parser);

    var keys = keySource.getKeys();
    assertEquals(1, keys.size());
    assertEquals(JwtSigningTestUtils.KEY_ID, keys.get(0).getKeyId());

    // later changes to the file are not picked up
    Files.delete(keyFile);
    assertSame(keys, keySource.getKeys());
  }

  @Test
  void testMissingFile() {
    var keyFile = tempDir.resolve("missing.json");
    var keySource = new FileKeySource(keyFile, parser);

    var error = assertThrows(AdminAuthException.class, keySource::getKeys);

    assertTrue(error.getMessage().startsWith("failed to read public keys from " + keyFile));
    assertTrue(AuthErrors.isCertificateFetchFailed(error));
  }

  @Test
  void testInMemoryKeySource() {
    var key = JwtSigningTestUtils.verificationKey(JwtSigningTestUtils.signingKey());
    var keySource = new InMemoryKeySource(List.of(key));

    assertEquals(List.of(key), keySource.getKeys());
  }
}
