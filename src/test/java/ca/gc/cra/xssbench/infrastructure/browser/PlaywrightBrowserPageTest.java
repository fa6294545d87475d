package ca.gc.cra.xssbench.infrastructure.browser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.xssbench.application.port.PageActionException;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.junit.jupiter.api.Test;

class PlaywrightBrowserPageTest {

  @Test
  void timeoutErrorMapsToTimeout() {
    TimeoutError cause = new TimeoutError("Timeout 5000ms exceeded.\n=== logs ===");

    PageActionException ex = PlaywrightBrowserPage.translate("goto", cause);

    assertEquals(PageActionException.Kind.TIMEOUT, ex.kind());
    assertEquals("goto failed: Timeout 5000ms exceeded.", ex.getMessage());
    assertSame(cause, ex.getCause());
  }

  @Test
  void destroyedContextIsRecognised() {
    PageActionException ex = PlaywrightBrowserPage.translate("evaluate",
        new PlaywrightException("Execution context was destroyed, most likely because of a navigation"));

    assertEquals(PageActionException.Kind.CONTEXT_DESTROYED, ex.kind());
  }

  @Test
  void otherFailuresKeepFirstLineOnly() {
    PageActionException ex = PlaywrightBrowserPage.translate("click",
        new PlaywrightException("Target closed\nCall log:\n  - waiting"));

    assertEquals(PageActionException.Kind.OTHER, ex.kind());
    assertEquals("click failed: Target closed", ex.getMessage());
  }
}
