package ca.gc.cra.patmat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndNamedSections() throws IOException {
    Path yaml = tempDir.resolve("patmat.yaml");
    Files.writeString(yaml, """
        common:
          metricPrefix: shapes
          arityPolicy: lenient
        Describe:
          arityPolicy: strict
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "describe").orElseThrow();

    assertEquals("shapes", map.get("metricPrefix"));
    assertEquals("strict", map.get("arityPolicy"));
  }

  @Test
  void eachGenericSeesOnlyItsOwnSectionOverCommon() throws IOException {
    Path yaml = tempDir.resolve("generics.yaml");
    Files.writeString(yaml, """
        common:
          arityPolicy: lenient
          maxDiagnosticBytes: 512
        describe:
          arityPolicy: strict
        add:
          maxDiagnosticBytes: 128
        """);

    Map<String, String> describe = YamlConfigLoader.load(yaml, "describe").orElseThrow();
    Map<String, String> add = YamlConfigLoader.load(yaml, " ADD ").orElseThrow();
    Map<String, String> undeclared = YamlConfigLoader.load(yaml, "area").orElseThrow();

    assertEquals(Map.of("arityPolicy", "strict", "maxDiagnosticBytes", "512"), describe);
    assertEquals(Map.of("arityPolicy", "lenient", "maxDiagnosticBytes", "128"), add);
    assertEquals(Map.of("arityPolicy", "lenient", "maxDiagnosticBytes", "512"), undeclared);
  }

  @Test
  void loadFlattensNestedMaps() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        add:
          diagnostics:
            maxBytes: 64
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "add").orElseThrow();
    assertEquals("64", map.get("diagnostics.maxBytes"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "add");
    assertTrue(result.isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "add").orElseThrow());
  }

  @Test
  void arraysAreRejected() throws IOException {
    Path yaml = tempDir.resolve("array.yaml");
    Files.writeString(yaml, """
        common:
          tags: [a, b]
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "add"));
  }

  @Test
  void malformedYamlIsReportedAsIllegalArgument() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "common: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "add"));
  }
}
