package ca.gc.cra.patmat.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the {@link DispatchConfig} of one generic function with precedence
 * system properties &gt; YAML &gt; defaults.
 *
 * <p>System properties use the {@code patmat.} prefix, for example {@code -Dpatmat.arityPolicy=strict}.</p>
 */
public final class DispatchConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(DispatchConfigLoader.class);

  /** Prefix of system properties read as overrides. */
  public static final String PROPERTY_PREFIX = "patmat.";

  private DispatchConfigLoader() {}

  /**
   * Loads the configuration for {@code genericName} from {@code yamlPath} and the JVM system properties.
   *
   * @param yamlPath YAML file; a missing file contributes nothing
   * @param genericName section of the YAML file to apply over {@code common}
   * @return effective configuration
   * @throws IOException when the YAML file cannot be read
   * @throws IllegalArgumentException when YAML or values are malformed
   */
  public static DispatchConfig load(Path yamlPath, String genericName) throws IOException {
    Optional<Map<String, String>> yaml = YamlConfigLoader.load(yamlPath, genericName);
    return resolve(yaml, System.getProperties(), log::warn);
  }

  /**
   * Merges defaults, YAML settings and {@code patmat.}-prefixed properties.
   *
   * @param yaml YAML-derived settings, if any
   * @param properties property source for overrides
   * @param warn consumer invoked when a property overrides a YAML key
   * @return effective configuration
   * @throws IllegalArgumentException when a value is malformed
   */
  public static DispatchConfig resolve(
      Optional<Map<String, String>> yaml, Properties properties, Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(DispatchConfig.defaultsAsMap());
    merged.putAll(yamlCopy);

    if (properties != null) {
      for (String name : properties.stringPropertyNames()) {
        if (!name.startsWith(PROPERTY_PREFIX)) {
          continue;
        }
        String key = name.substring(PROPERTY_PREFIX.length());
        if (key.isBlank()) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("System property overrides YAML for key: " + key);
        }
        merged.put(key, properties.getProperty(name));
      }
    }
    return DispatchConfig.fromMap(merged);
  }
}
