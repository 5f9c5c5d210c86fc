package ca.gc.cra.balancer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Balancer command dispatcher"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: balancer"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void designCommandReceivesFlags() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"DESIGN", "inputs=30,30,30", "outputs=90"}));
    assertTrue(buffer.toString().contains("\tM0 -> O0 [label=90]\n"));

    StringWriter help = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(help));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"design", "-h"}));
    assertTrue(help.toString().contains("Balancer network designer"));
  }
}
