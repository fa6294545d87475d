package ca.gc.cra.xssbench.domain.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class ExpectedTagTest {

  @Test
  void parsesBareAndAttributedShapes() {
    ExpectedTag bare = ExpectedTag.parse(" B ");
    assertEquals("b", bare.name());
    assertTrue(bare.bare());

    ExpectedTag img = ExpectedTag.parse("img[SRC, alt]");
    assertEquals(Set.of("src", "alt"), img.attributes());
    assertFalse(img.bare());
    assertEquals("img[alt,src]", img.shape());
  }

  @Test
  void rejectsMalformedShapes() {
    IllegalArgumentException empty = assertThrows(IllegalArgumentException.class, () -> ExpectedTag.parse("a[]"));
    assertTrue(empty.getMessage().contains("must not use empty brackets"));
    assertThrows(IllegalArgumentException.class, () -> ExpectedTag.parse("a[ ,href]"));
    assertThrows(IllegalArgumentException.class, () -> ExpectedTag.parse("<a>"));
    assertThrows(IllegalArgumentException.class, () -> ExpectedTag.parse(""));
  }
}
