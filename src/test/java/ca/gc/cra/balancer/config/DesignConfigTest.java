package ca.gc.cra.balancer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.balancer.application.port.GraphOutputPort;
import ca.gc.cra.balancer.application.port.MetricsPort;
import ca.gc.cra.balancer.domain.flow.FlowSpec;
import ca.gc.cra.balancer.infrastructure.output.ConsoleGraphOutputAdapter;
import ca.gc.cra.balancer.infrastructure.output.FileGraphOutputAdapter;
import ca.gc.cra.balancer.infrastructure.render.GraphvizDotRenderer;
import ca.gc.cra.balancer.infrastructure.render.JsonGraphRenderer;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class DesignConfigTest {

  @Test
  void wholeRatesAreUsedAsGiven() {
    DesignConfig config = DesignConfig.fromMap(Map.of("inputs", "480, 480,480", "outputs", "720,720"));

    assertFalse(config.apportioned());
    assertEquals(new FlowSpec(List.of(480, 480, 480), List.of(720, 720)), config.toFlowSpec());
    assertEquals(GraphFormat.DOT, config.format());
    assertEquals(Optional.empty(), config.output());
  }

  @Test
  void unequalWholeTotalsAreNotRebalanced() {
    FlowSpec spec = DesignConfig.fromMap(Map.of("inputs", "10", "outputs", "7")).toFlowSpec();

    assertEquals(10L, spec.inputTotal());
    assertEquals(7L, spec.outputTotal());
  }

  @Test
  void fractionalRatesAreApportionedToCommonTotal() {
    DesignConfig config = DesignConfig.fromMap(Map.of("inputs", "7.5,2.5", "outputs", "2.25,7.75"));

    assertTrue(config.apportioned());
    assertEquals(new FlowSpec(List.of(7, 3), List.of(2, 8)), config.toFlowSpec());
  }

  @Test
  void targetScalesBothSides() {
    DesignConfig config = DesignConfig.fromMap(Map.of("inputs", "1,1", "outputs", "1,1,2", "target", "12"));

    assertEquals(OptionalLong.of(12), config.target());
    assertEquals(new FlowSpec(List.of(6, 6), List.of(3, 3, 6)), config.toFlowSpec());
  }

  @Test
  void missingOrInvalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> DesignConfig.fromMap(Map.of("outputs", "1")));
    assertThrows(IllegalArgumentException.class, () -> DesignConfig.fromMap(Map.of("inputs", "1")));
    assertThrows(IllegalArgumentException.class,
        () -> DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1", "target", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1", "target", "-3")));
    assertThrows(IllegalArgumentException.class,
        () -> DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1", "format", "svg")));
  }

  @Test
  void outputPathIsResolvedUnlessStdout() {
    DesignConfig toFile = DesignConfig.fromMap(Map.of(
        "inputs", "1", "outputs", "1", "out", "plans/../iron.json", "format", "JSON", "pretty", "true"));

    assertEquals(Optional.of(Path.of("iron.json").toAbsolutePath().normalize()), toFile.output());
    assertEquals(GraphFormat.JSON, toFile.format());
    assertTrue(toFile.pretty());
    assertEquals(Optional.empty(),
        DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1", "out", " - ")).output());
  }

  @Test
  void compositionRootSelectsAdapters() {
    PrintWriter console = new PrintWriter(new StringWriter());
    CompositionRoot dotToConsole = new CompositionRoot(
        DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1")), MetricsPort.NO_OP);
    CompositionRoot jsonToFile = new CompositionRoot(
        DesignConfig.fromMap(Map.of("inputs", "1", "outputs", "1", "format", "json", "out", "plan.json")),
        MetricsPort.NO_OP);

    assertTrue(dotToConsole.renderer() instanceof GraphvizDotRenderer);
    assertTrue(jsonToFile.renderer() instanceof JsonGraphRenderer);
    GraphOutputPort consolePort = dotToConsole.outputPort(false, console);
    GraphOutputPort filePort = jsonToFile.outputPort(false, console);
    assertTrue(consolePort instanceof ConsoleGraphOutputAdapter);
    assertTrue(filePort instanceof FileGraphOutputAdapter);
    assertEquals(MetricsPort.NO_OP, dotToConsole.metrics());
  }
}
