package ca.gc.cra.patmat.config;

import ca.gc.cra.patmat.domain.dispatch.ArityPolicy;
import ca.gc.cra.patmat.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Settings applied to a generic function when it is built.
 *
 * @param arityPolicy policy for calls with fewer arguments than spec tokens
 * @param metricsEnabled whether the configured metrics port receives updates
 * @param metricPrefix first segment of every metric key
 * @param maxDiagnosticBytes byte budget for argument renderings in dispatch failures
 * @param traceDispatch whether dispatch loggers are raised to TRACE when the generic is built
 * @since 0.1.0
 */
public record DispatchConfig(
    ArityPolicy arityPolicy,
    boolean metricsEnabled,
    String metricPrefix,
    int maxDiagnosticBytes,
    boolean traceDispatch) {

  public static final String ARITY_POLICY = "arityPolicy";
  public static final String METRICS_ENABLED = "metricsEnabled";
  public static final String METRIC_PREFIX = "metricPrefix";
  public static final String MAX_DIAGNOSTIC_BYTES = "maxDiagnosticBytes";
  public static final String TRACE_DISPATCH = "traceDispatch";

  private static final DispatchConfig DEFAULTS =
      new DispatchConfig(ArityPolicy.LENIENT, true, "dispatch", 512, false);

  /**
   * Validates components.
   */
  public DispatchConfig {
    Objects.requireNonNull(arityPolicy, "arityPolicy");
    metricPrefix = Strings.requireNonBlank(METRIC_PREFIX, metricPrefix).trim();
    if (maxDiagnosticBytes <= 0) {
      throw new IllegalArgumentException(MAX_DIAGNOSTIC_BYTES + " must be positive");
    }
  }

  /**
   * Returns the built-in defaults: lenient arity, metrics on with prefix {@code dispatch}, 512 diagnostic
   * bytes, tracing off.
   *
   * @return default configuration
   */
  public static DispatchConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Renders the defaults as a flat key/value map, the lowest layer of {@link DispatchConfigLoader}.
   *
   * @return mutable copy of the default settings
   */
  public static Map<String, String> defaultsAsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(ARITY_POLICY, DEFAULTS.arityPolicy().name().toLowerCase(Locale.ROOT));
    map.put(METRICS_ENABLED, Boolean.toString(DEFAULTS.metricsEnabled()));
    map.put(METRIC_PREFIX, DEFAULTS.metricPrefix());
    map.put(MAX_DIAGNOSTIC_BYTES, Integer.toString(DEFAULTS.maxDiagnosticBytes()));
    map.put(TRACE_DISPATCH, Boolean.toString(DEFAULTS.traceDispatch()));
    return map;
  }

  /**
   * Builds a configuration from flat settings; absent keys keep their defaults.
   *
   * @param settings flat key/value settings
   * @return parsed configuration
   * @throws IllegalArgumentException for malformed values
   */
  public static DispatchConfig fromMap(Map<String, String> settings) {
    Objects.requireNonNull(settings, "settings");
    ArityPolicy policy = settings.containsKey(ARITY_POLICY)
        ? ArityPolicy.from(settings.get(ARITY_POLICY))
        : DEFAULTS.arityPolicy();
    return new DispatchConfig(
        policy,
        parseBoolean(METRICS_ENABLED, settings.get(METRICS_ENABLED), DEFAULTS.metricsEnabled()),
        settings.getOrDefault(METRIC_PREFIX, DEFAULTS.metricPrefix()),
        parseInt(MAX_DIAGNOSTIC_BYTES, settings.get(MAX_DIAGNOSTIC_BYTES), DEFAULTS.maxDiagnosticBytes()),
        parseBoolean(TRACE_DISPATCH, settings.get(TRACE_DISPATCH), DEFAULTS.traceDispatch()));
  }

  /**
   * Returns a copy with a different arity policy.
   *
   * @param policy new policy
   * @return updated configuration
   */
  public DispatchConfig withArityPolicy(ArityPolicy policy) {
    return new DispatchConfig(policy, metricsEnabled, metricPrefix, maxDiagnosticBytes, traceDispatch);
  }

  private static boolean parseBoolean(String key, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false but was: " + value);
    };
  }

  private static int parseInt(String key, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer but was: " + value, ex);
    }
  }
}
