package ca.gc.cra.patmat.infrastructure.metrics;

import ca.gc.cra.patmat.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards generic-function counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created on first use per metric key and cached. When the bootstrap resolved to
 * noop mode every update is dropped.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("patmat.metric.key");
  private static final String FALLBACK_METRIC_NAME = "patmat.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter configured through {@code otel.*} system properties or
   * {@code OTEL_*} environment variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.meter = null;
    } else {
      this.meter = bootstrap.meter();
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    Instrument<LongCounter> counter = counters.computeIfAbsent(key, this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (meter == null) {
      return;
    }
    Instrument<LongHistogram> histogram = histograms.computeIfAbsent(key, this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /**
   * Pushes pending measurements to the configured reader.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Dispatch counter for " + key)
        .build();
    logSanitized("counter", key, name);
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Dispatch observation for " + key)
        .build();
    logSanitized("histogram", key, name);
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private static void logSanitized(String kind, String key, String name) {
    if (!name.equals(key)) {
      log.debug("Sanitized {} name '{}' -> '{}'", kind, key, name);
    }
  }

  /**
   * Lower-cases the key and replaces characters OpenTelemetry rejects in instrument names.
   */
  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T instrument, Attributes attributes) {}
}
