package ca.gc.cra.xssbench.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter out;

  @BeforeEach
  void setUp() {
    out = new StringWriter();
    CliPrinter.setWritersForTesting(new PrintWriter(out, true), new PrintWriter(new StringWriter(), true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriters();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(out.toString().contains("usage: xssbench <run|sanitizers> [options]"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(out.toString().contains("sanitizers  List available sanitizers"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"SANITIZERS"}));
    assertTrue(out.toString().contains("noop: "));
  }

  @Test
  void subcommandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"run", "--help"}));
    assertTrue(out.toString().contains("xssbench run: execute XSS vectors"));
  }
}
