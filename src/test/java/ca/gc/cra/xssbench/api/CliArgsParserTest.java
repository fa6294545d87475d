package ca.gc.cra.xssbench.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"browser=chromium", "timeoutMs = 500"});
    assertEquals("chromium", map.get("browser"));
    assertEquals("500", map.get("timeoutMs"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=a=b,c=d"});
    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsArgumentsWithoutValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid", "key=value"}));
    assertEquals("argument must be key=value (was 'invalid')", ex.getMessage());
  }

  @Test
  void joinsRepeatedListKeys() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"vectors=a.json", "vectors=b.json,c.json"}, Set.of("vectors"));
    assertEquals("a.json,b.json,c.json", map.get("vectors"));
  }

  @Test
  void rejectsRepeatedScalarKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"workers=1", "workers=2"}, Set.of("vectors")));
    assertEquals("argument workers given more than once", ex.getMessage());
  }

  @Test
  void blankValueIsKeptForReset() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"timeoutMs="});
    assertEquals("", map.get("timeoutMs"));
  }

  @Test
  void rejectsMalformedKeys() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"1st=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
  }

  @Test
  void nullArgsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
