package ca.gc.cra.balancer.api;

import ca.gc.cra.balancer.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.balancer.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves telemetry-related CLI settings into {@link TelemetrySettings}.
 *
 * <p>Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}
 * from the supplied map so the remaining keys describe only the design.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings resolve(Map<String, String> args) {
    TelemetrySettings.Exporter exporter = TelemetrySettings.Exporter.parse(args.remove("metricsExporter"));

    String endpoint = trimToEmpty(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }

    String resourceAttributes = trimToEmpty(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    log.debug("Resolved metrics exporter {} (endpoint={})", exporter, endpoint.isEmpty() ? "<default>" : endpoint);
    return new TelemetrySettings(exporter, endpoint, resourceAttributes);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
