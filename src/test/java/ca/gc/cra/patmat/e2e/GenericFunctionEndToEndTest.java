package ca.gc.cra.patmat.e2e;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.patmat.application.dispatch.GenericFunction;
import ca.gc.cra.patmat.application.dispatch.PatternConstructor;
import ca.gc.cra.patmat.application.dispatch.PatternConstructors;
import ca.gc.cra.patmat.config.DispatchConfig;
import ca.gc.cra.patmat.config.DispatchConfigLoader;
import ca.gc.cra.patmat.config.YamlConfigLoader;
import ca.gc.cra.patmat.domain.dispatch.ArityPolicy;
import ca.gc.cra.patmat.domain.dispatch.CallArguments;
import ca.gc.cra.patmat.domain.dispatch.DispatchFailure;
import ca.gc.cra.patmat.domain.dispatch.Implementation;
import ca.gc.cra.patmat.domain.pattern.Patterns;
import ca.gc.cra.patmat.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GenericFunctionEndToEndTest {

  @TempDir Path tempDir;

  @Test
  void addDispatchesOnArgumentTypes() {
    GenericFunction<Integer, Integer> add = GenericFunction.declare("add", PatternConstructors.byType());
    add.register(Implementation.binary((x, y) -> (Integer) x + (Integer) y), Integer.class, Integer.class);
    add.register(Implementation.binary((x, y) -> (Integer) x + Integer.parseInt((String) y)),
        Integer.class, String.class);

    assertEquals(3, add.invoke(1, 2));
    assertEquals(11, add.invoke(1, "10"));

    DispatchFailure failure = assertThrows(DispatchFailure.class, () -> add.invoke(1, 1.5));
    assertEquals("add", failure.genericName());
    assertEquals(CallArguments.of(1, 1.5), failure.arguments());
  }

  @Test
  void describeDispatchesOnDerivedTag() {
    PatternConstructor byTag = tag -> Patterns.compose(Patterns.equal(tag), Patterns.key("type"));
    GenericFunction<String, String> describe = GenericFunction.declare("describe", byTag);
    describe.register(Implementation.unary(tag -> "a " + tag + " moving freely"), "particle");
    describe.register(Implementation.unary(tag -> "a " + tag + " with three sides"), "triangle");

    assertEquals("a particle moving freely", describe.invoke(Map.of("type", "particle")));
    assertEquals("a triangle with three sides", describe.invoke(Map.of("type", "triangle")));
    assertThrows(DispatchFailure.class, () -> describe.invoke(Map.of("type", "unknown")));
  }

  @Test
  void keyDispatchPassesWholeArgument() {
    GenericFunction<String, String> area = GenericFunction.declare("area", PatternConstructors.byKey("type"));
    area.register(Implementation.unary(shape -> "r=" + ((Map<?, ?>) shape).get("r")), "circle");

    assertEquals("r=2", area.invoke(Map.of("type", "circle", "r", 2)));
  }

  @Test
  void dynamicConstructorFollowsFirstArgument() {
    GenericFunction<String, String> show = GenericFunction.declareDynamic("show",
        arguments -> arguments.get(0) instanceof Map
            ? Optional.of(PatternConstructors.byKey("kind"))
            : Optional.empty());
    show.register(args -> "point " + args.get(0), "point");

    assertEquals("point {kind=point}", show.invoke(Map.of("kind", "point")));
    assertEquals("point point", show.invoke("point"));
    assertThrows(DispatchFailure.class, () -> show.invoke(Map.of("kind", "line")));
  }

  @Test
  void configuredGenericUsesYamlSettings() throws IOException {
    Path yaml = tempDir.resolve("patmat.yaml");
    Files.writeString(yaml, """
        common:
          metricPrefix: shapes
        pair:
          arityPolicy: strict
        """);
    DispatchConfig config = DispatchConfigLoader.resolve(
        YamlConfigLoader.load(yaml, "pair"), new Properties(), null);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    GenericFunction<String, String> pair = GenericFunction.<String>builder("pair")
        .config(config)
        .metrics(metrics)
        .build();
    pair.register(args -> "both", 1, 2);

    assertEquals(ArityPolicy.STRICT, pair.arityPolicy());
    assertEquals("both", pair.invoke(1, 2, 3));
    assertThrows(DispatchFailure.class, () -> pair.invoke(1));
    assertEquals(2, metrics.count("shapes.pair.calls"));
    assertEquals(1, metrics.count("shapes.pair.failures"));
  }
}
