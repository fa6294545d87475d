package ca.gc.cra.xssbench.application.bench;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.xssbench.application.bench.SanitizerInputs.PreparedInput;
import ca.gc.cra.xssbench.domain.bench.Sanitizer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.domain.vector.Vector;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SanitizerInputsTest {
  private static final Sanitizer UNIVERSAL = Sanitizer.universal("noop", "", (html, context) -> html);

  @Test
  void markupContextsPassThrough() {
    for (PayloadContext context : new PayloadContext[] {
        PayloadContext.HTML, PayloadContext.HTML_HEAD, PayloadContext.JS, PayloadContext.HTTP_LEAK}) {
      PreparedInput input = SanitizerInputs.prepare(Vector.unchecked("v", "<b>", context), UNIVERSAL);
      assertEquals(new PreparedInput("<b>", context), input);
    }
  }

  @Test
  void hrefIsWrappedUnlessDeclared() {
    Vector href = Vector.unchecked("v", "javascript:alert(1)", PayloadContext.HREF);
    Sanitizer declared = new Sanitizer("url", "", (html, context) -> html,
        Optional.of(Set.of(PayloadContext.HTML, PayloadContext.HREF)));

    assertEquals(new PreparedInput("<a href=\"javascript:alert(1)\">x</a>", PayloadContext.HTML),
        SanitizerInputs.prepare(href, UNIVERSAL));
    assertEquals(new PreparedInput("javascript:alert(1)", PayloadContext.HREF),
        SanitizerInputs.prepare(href, declared));
  }

  @Test
  void onerrorIsAlwaysWrapped() {
    Vector onerror = Vector.unchecked("v", "alert(1)", PayloadContext.ONERROR_ATTR);

    assertEquals(new PreparedInput("<img src=\"nonexistent://x\" onerror=\"alert(1)\">", PayloadContext.HTML),
        SanitizerInputs.prepare(onerror, UNIVERSAL));
  }
}
