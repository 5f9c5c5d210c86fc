package ca.gc.cra.balancer.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry settings for one CLI run.
 *
 * @param exporter metrics exporter mode
 * @param endpoint OTLP endpoint used when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Validates components and substitutes defaults for blank values. */
  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable metrics export.
   *
   * @return settings with {@link Exporter#NONE}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, null, null);
  }

  /** Supported metrics exporters. */
  public enum Exporter {
    /** OTLP over gRPC. */
    OTLP,
    /** Metrics are discarded. */
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank selects {@link #OTLP}
     * @return parsed exporter
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
  }
}
