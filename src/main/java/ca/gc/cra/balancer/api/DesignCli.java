package ca.gc.cra.balancer.api;

import ca.gc.cra.balancer.application.pipeline.BalancerDesignUseCase;
import ca.gc.cra.balancer.application.port.GraphOutputPort;
import ca.gc.cra.balancer.application.port.MetricsPort;
import ca.gc.cra.balancer.config.CompositionRoot;
import ca.gc.cra.balancer.config.ConfigMerger;
import ca.gc.cra.balancer.config.DefaultsForMode;
import ca.gc.cra.balancer.config.DesignConfig;
import ca.gc.cra.balancer.config.YamlConfigLoader;
import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.domain.flow.InfeasibleFlowException;
import ca.gc.cra.balancer.domain.graph.BalancerGraph;
import ca.gc.cra.balancer.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.balancer.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.balancer.logging.LoggingConfigurator;
import ca.gc.cra.balancer.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for designing a balancer network from input and output flow lists.
 *
 * @since 0.1.0
 */
public final class DesignCli {
  private static final Logger log = LoggerFactory.getLogger(DesignCli.class);
  private static final String SUMMARY_USAGE =
      "usage: design inputs=N[,N...] outputs=N[,N...] [format=dot|json] [out=PATH|-] "
          + "[target=N] [pretty=true|false] [config=PATH] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Balancer network designer

      Usage:
        design inputs=480,480,480 outputs=45,45,45,... [options]

      Required:
        inputs=N[,N...]          Input flow rates, in order
        outputs=N[,N...]         Output flow rates, in order; totals must match the inputs

      Optional:
        format=dot|json          Rendering format (default dot)
        out=PATH|-               Output file, or - for stdout (default -)
        target=N                 Whole total to apportion fractional rates to
        pretty=true|false        Indent JSON output (format=json only)
        config=PATH              YAML file with common/design sections
        --dry-run                Validate inputs and print the plan without designing
        --allow-overwrite        Permit replacing an existing output file
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Notes:
        Fractional rates (or an explicit target) are apportioned to whole numbers first.
        Exit code 4 means the input and output totals differ.
      """;

  private DesignCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the design CLI and returns an exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for design CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "design");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          "design", yamlConfig, kv, DefaultsForMode.asFlatMap("design"), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid design arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite =
        input.hasFlag("--allow-overwrite") || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    TelemetrySettings telemetry;
    DesignConfig config;
    FlowSpec spec;
    try {
      telemetry = TelemetryConfigurator.resolve(configInputs);
      config = DesignConfig.fromMap(configInputs);
      config.output().ifPresent(file -> Paths.validateOutputFile(file, allowOverwrite));
      spec = config.toFlowSpec();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid design arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (config.apportioned()) {
      log.info("Apportioned fractional rates to whole flows: inputs={}, outputs={}",
          spec.inputs(), spec.outputs());
    }

    if (dryRun) {
      return printDryRunPlan(config, spec, allowOverwrite);
    }

    MetricsPort metrics = telemetry.exporter() == TelemetrySettings.Exporter.NONE
        ? MetricsPort.NO_OP
        : new OpenTelemetryMetricsAdapter(telemetry);
    try {
      CompositionRoot root = new CompositionRoot(config, metrics);
      BalancerDesignUseCase useCase = root.designUseCase();
      try (GraphOutputPort output = root.outputPort(allowOverwrite, CliPrinter.writer())) {
        BalancerGraph graph = useCase.run(spec, output);
        log.info("Balancer design written to {} as {} ({} nodes, {} edges)",
            config.output().map(Path::toString).orElse("stdout"),
            config.format(), graph.nodes().size(), graph.edges().size());
      }
      return ExitCode.SUCCESS;
    } catch (InfeasibleFlowException ex) {
      log.error("Infeasible design: {}", ex.getMessage());
      return ExitCode.INFEASIBLE;
    } catch (IOException ex) {
      log.error("Failed to write balancer design to {}",
          config.output().map(Path::toString).orElse("stdout"), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in design CLI", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter adapter) {
        adapter.close();
      }
    }
  }

  private static ExitCode printDryRunPlan(DesignConfig config, FlowSpec spec, boolean allowOverwrite) {
    boolean balanced = spec.inputTotal() == spec.outputTotal();
    CliPrinter.printLines(
        "Design dry-run: no graph will be produced.",
        " Inputs            : " + spec.inputs() + " (total " + spec.inputTotal() + ")",
        " Outputs           : " + spec.outputs() + " (total " + spec.outputTotal() + ")",
        " Apportioned       : " + config.apportioned(),
        " Balanced          : " + balanced,
        " Format            : " + config.format(),
        " Output            : " + config.output().map(Path::toString).orElse("<stdout>"),
        " Allow overwrite   : " + allowOverwrite,
        " Re-run without --dry-run to design the network.");
    if (!balanced) {
      log.error("Infeasible design: total input flow {} must equal total output flow {}",
          spec.inputTotal(), spec.outputTotal());
      return ExitCode.INFEASIBLE;
    }
    return ExitCode.SUCCESS;
  }
}
