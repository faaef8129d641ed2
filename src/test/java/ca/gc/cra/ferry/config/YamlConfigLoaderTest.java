package ca.gc.cra.ferry.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndCommandSections() throws IOException {
    Path yaml = tempDir.resolve("ferry.yaml");
    Files.writeString(yaml, """
        common:
          endpoint: https://api.example.com/v1/assets
          maxWorkers: 4
        upload:
          maxWorkers: 16
          batchSize: 500
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "upload");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("https://api.example.com/v1/assets", map.get("endpoint"));
    assertEquals("16", map.get("maxWorkers"));
    assertEquals("500", map.get("batchSize"));
  }

  @Test
  void nestedMappingsFlattenToDottedKeys() {
    Map<String, String> map = YamlConfigLoader.parse(new StringReader("""
        Upload:
          body:
            mode: upsert
            dryRun: false
        """), "upload", "inline", name -> null);

    assertEquals("upsert", map.get("body.mode"));
    assertEquals("false", map.get("body.dryRun"));
  }

  @Test
  void environmentReferencesAreResolved() throws IOException {
    Path yaml = tempDir.resolve("env.yaml");
    Files.writeString(yaml, """
        upload:
          endpoint: https://${API_HOST}/v1/${DATASET}/items
        """);
    Map<String, String> env = Map.of("API_HOST", "api.example.com", "DATASET", "assets");

    Map<String, String> map = YamlConfigLoader.load(yaml, "upload", env::get).orElseThrow();

    assertEquals("https://api.example.com/v1/assets/items", map.get("endpoint"));
  }

  @Test
  void unsetEnvironmentReferenceIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("""
            common:
              userAgent: ${FERRY_AGENT}
            """), "upload", "inline", name -> null));

    assertEquals("Environment variable FERRY_AGENT referenced by userAgent is not set", ex.getMessage());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "upload").isPresent());
  }

  @Test
  void arraysAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        upload:
          endpoints:
            - https://a.example.com
        """), "upload", "inline", name -> null));
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - upload:
            batchSize: 10
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "upload"));
  }
}
