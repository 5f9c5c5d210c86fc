package ca.gc.cra.balancer.infrastructure.metrics;

import ca.gc.cra.balancer.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that forwards balancer counters and observations to OpenTelemetry.
 *
 * <p>Counters and histograms are created lazily per key and cached. Closing the adapter flushes
 * and shuts down the meter provider, which a short-lived CLI run must do before exiting.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("balancer.metric.key");
  private static final String FALLBACK_METRIC_NAME = "balancer.metric";

  private final OpenTelemetryBootstrap.Provider provider;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting according to {@code settings}.
   *
   * @param settings resolved telemetry settings
   */
  public OpenTelemetryMetricsAdapter(TelemetrySettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  private OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Provider provider) {
    this.provider = provider;
  }

  /**
   * Creates an adapter reporting to {@code reader}, typically an in-memory reader.
   *
   * @param reader metric reader registered with a fresh meter provider
   * @return adapter bound to the reader
   */
  static OpenTelemetryMetricsAdapter forReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  /**
   * Whether metrics are actually exported.
   *
   * @return {@code false} when the exporter is disabled or failed to start
   */
  public boolean isActive() {
    return provider != null;
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (provider == null) {
      return;
    }
    Counter counter = counters.computeIfAbsent(key, k -> newCounter(provider.meter(), k));
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (provider == null) {
      return;
    }
    Histogram histogram = histograms.computeIfAbsent(key, k -> newHistogram(provider.meter(), k));
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    if (provider != null) {
      provider.forceFlush();
    }
  }

  @Override
  public void close() {
    if (provider != null) {
      provider.close();
    }
  }

  private static Counter newCounter(Meter meter, String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Balancer counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private static Histogram newHistogram(Meter meter, String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setDescription("Balancer observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
