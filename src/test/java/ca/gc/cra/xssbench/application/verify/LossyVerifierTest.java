package ca.gc.cra.xssbench.application.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.xssbench.domain.vector.ExpectedTag;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LossyVerifierTest {
  private final LossyVerifier verifier = new LossyVerifier();

  private static Optional<List<ExpectedTag>> tags(String... shapes) {
    List<ExpectedTag> out = new ArrayList<>();
    for (String shape : shapes) {
      out.add(ExpectedTag.parse(shape));
    }
    return Optional.of(out);
  }

  @Test
  void uncheckedVectorsAreNeverLossy() {
    assertEquals(LossyVerdict.INTACT, verifier.verify("", Optional.empty()));
  }

  @Test
  void matchingShapeIsIntact() {
    assertFalse(verifier.verify("<b>x</b>", tags("b")).lossy());
    assertFalse(verifier.verify("<a href=\"/x\" title=\"t\">y</a>", tags("a[href]")).lossy());
    assertFalse(verifier.verify("<IMG SRC=x><p>y</p>", tags("img[src]", "p")).lossy());
  }

  @Test
  void bareTagMustHaveNoAttributes() {
    LossyVerdict verdict = verifier.verify("<b class=\"c\">x</b>", tags("b"));

    assertTrue(verdict.lossy());
    assertEquals("Missing expected tags after sanitization: position 1: expected b, found b[class]",
        verdict.details());
  }

  @Test
  void strippedTagIsReportedAsMissing() {
    LossyVerdict verdict = verifier.verify("<p>t</p>", tags("p", "img[src]"));

    assertEquals("Missing expected tags after sanitization: position 2: missing img[src]", verdict.details());
  }

  @Test
  void extraTagIsReportedAsUnexpected() {
    LossyVerdict verdict = verifier.verify("<p></p><i>x</i>", tags("p"));

    assertEquals("Missing expected tags after sanitization: position 2: unexpected i", verdict.details());
  }

  @Test
  void droppedAttributeIsReported() {
    LossyVerdict verdict = verifier.verify("<img alt=\"a\">", tags("img[alt,src]"));

    assertEquals("Missing expected tags after sanitization: position 1: expected img[alt,src], found img[alt]",
        verdict.details());
  }

  @Test
  void emptyExpectationMeansNoElementMaySurvive() {
    assertFalse(verifier.verify("just text", tags()).lossy());

    LossyVerdict verdict = verifier.verify("<i>x</i><b>y</b>", tags());
    assertEquals("Expected no tags after sanitization, but found: i, b", verdict.details());
  }

  @Test
  void scriptContentsAreNotInspected() {
    assertFalse(verifier.verify("<script><b>x</b></script>", tags("script")).lossy());
  }

  @Test
  void nullOutputIsTreatedAsEmpty() {
    assertTrue(verifier.verify(null, tags("p")).lossy());
  }
}
