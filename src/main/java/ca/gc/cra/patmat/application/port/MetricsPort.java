package ca.gc.cra.patmat.application.port;

/**
 * <strong>What:</strong> Port abstracting dispatch metrics emission.
 * <p><strong>Why:</strong> Lets generic functions record call counts and latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for calls and dispatch failures.</li>
 *   <li>Record numeric observations such as candidate counts and latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates from every thread that
 * invokes a generic function.</p>
 * <p><strong>Performance:</strong> Calls sit on the dispatch path and should be non-blocking.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract
 * ({@code <prefix>.<generic>.calls}, {@code .candidates}, {@code .failures}, {@code .latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code dispatch.add.calls}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, candidate count)
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
