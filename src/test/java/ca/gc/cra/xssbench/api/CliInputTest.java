package ca.gc.cra.xssbench.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromTokens() {
    CliInput input = CliInput.parse(new String[] {"run", "--Fail-Fast", "browser=chromium", "-v"});

    assertEquals("run", input.firstToken());
    assertArrayEquals(new String[] {"run", "browser=chromium"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--fail-fast"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void helpAliasesCollapse() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).hasFlag("--help"));
  }

  @Test
  void withoutFirstTokenKeepsFlags() {
    CliInput input = CliInput.parse(new String[] {"run", "workers=2", "--dry-run"});

    assertArrayEquals(new String[] {"workers=2", "--dry-run"}, input.withoutFirstToken());
  }

  @Test
  void unknownFlagsIgnoreHelpAndVerbose() {
    CliInput input = CliInput.parse(new String[] {"--debug", "--help", "--dry-run", "--turbo"});

    assertEquals(Set.of("--turbo"), input.unknownFlags(Set.of("--dry-run")));
  }

  @Test
  void emptyArgs() {
    CliInput input = CliInput.parse(null);

    assertNull(input.firstToken());
    assertEquals(0, input.withoutFirstToken().length);
    assertFalse(input.hasFlag(" "));
  }
}
