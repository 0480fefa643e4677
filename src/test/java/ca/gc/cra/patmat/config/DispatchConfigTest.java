package ca.gc.cra.patmat.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.patmat.domain.dispatch.ArityPolicy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DispatchConfigTest {

  @Test
  void defaultsAreLenientWithMetrics() {
    DispatchConfig defaults = DispatchConfig.defaults();
    assertEquals(ArityPolicy.LENIENT, defaults.arityPolicy());
    assertTrue(defaults.metricsEnabled());
    assertEquals("dispatch", defaults.metricPrefix());
    assertEquals(512, defaults.maxDiagnosticBytes());
    assertFalse(defaults.traceDispatch());
    assertEquals(defaults, DispatchConfig.fromMap(DispatchConfig.defaultsAsMap()));
  }

  @Test
  void fromMapParsesEveryKey() {
    DispatchConfig config = DispatchConfig.fromMap(Map.of(
        "arityPolicy", "STRICT",
        "metricsEnabled", "false",
        "metricPrefix", " shapes ",
        "maxDiagnosticBytes", "64",
        "traceDispatch", "true"));
    assertEquals(new DispatchConfig(ArityPolicy.STRICT, false, "shapes", 64, true), config);
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> DispatchConfig.fromMap(Map.of("metricsEnabled", "yes")));
    assertThrows(IllegalArgumentException.class,
        () -> DispatchConfig.fromMap(Map.of("maxDiagnosticBytes", "lots")));
    assertThrows(IllegalArgumentException.class,
        () -> DispatchConfig.fromMap(Map.of("maxDiagnosticBytes", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> DispatchConfig.fromMap(Map.of("metricPrefix", " ")));
    assertThrows(IllegalArgumentException.class,
        () -> DispatchConfig.fromMap(Map.of("arityPolicy", "sloppy")));
  }

  @Test
  void withArityPolicyKeepsOtherSettings() {
    DispatchConfig strict = DispatchConfig.defaults().withArityPolicy(ArityPolicy.STRICT);
    assertEquals(ArityPolicy.STRICT, strict.arityPolicy());
    assertEquals("dispatch", strict.metricPrefix());
  }
}
