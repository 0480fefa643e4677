package ca.gc.cra.patmat.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterHistogramTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void observeRecordsHistogramSamples() {
    adapter.observe("dispatch.describe.latencyNanos", 1_000L);
    adapter.observe("dispatch.describe.latencyNanos", 3_000L);

    MetricData histogram = reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals("dispatch.describe.latencynanos"))
        .findFirst()
        .orElseThrow();

    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }
}
