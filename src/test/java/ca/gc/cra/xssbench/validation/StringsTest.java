package ca.gc.cra.xssbench.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void splitCsvTrimsAndSkipsEmptyEntries() {
    assertEquals(List.of("noop", "jsoup"), Strings.splitCsv("sanitizers", " noop, ,jsoup,"));
    assertEquals(List.of(), Strings.splitCsv("sanitizers", "  "));
    assertEquals(List.of(), Strings.splitCsv("sanitizers", null));
  }

  @Test
  void splitCsvRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.splitCsv("vectors", "a.json,b\u0007.json"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("otelResourceAttributes", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }
}
