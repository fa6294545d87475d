package ca.gc.cra.xssbench.infrastructure.browser;

import ca.gc.cra.xssbench.application.port.BrowserPage;
import ca.gc.cra.xssbench.application.port.PageActionException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Dialog;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Route;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrowserPage} backed by a Playwright page and the browser process that owns it.
 *
 * <p>Playwright dispatches page events on the thread that is inside a Playwright call, so listeners run
 * during {@link #navigate}, {@link #evaluate}, {@link #click} and {@link #waitFor}.</p>
 */
final class PlaywrightBrowserPage implements BrowserPage {
  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserPage.class);
  private static final String ROUTE_ALL = "**/*";

  private final Browser browser;
  private final Page page;

  PlaywrightBrowserPage(Browser browser, Page page) {
    this.browser = Objects.requireNonNull(browser, "browser");
    this.page = Objects.requireNonNull(page, "page");
  }

  @Override
  public void addInitScript(String script) throws PageActionException {
    try {
      page.addInitScript(script);
    } catch (PlaywrightException ex) {
      throw translate("addInitScript", ex);
    }
  }

  @Override
  public void setDefaultTimeout(long timeoutMs) {
    page.setDefaultTimeout(timeoutMs);
    page.setDefaultNavigationTimeout(timeoutMs);
  }

  @Override
  public void onDialog(Consumer<DialogHandle> listener) {
    page.onDialog(dialog -> listener.accept(new PlaywrightDialog(dialog)));
  }

  @Override
  public void onFrameNavigated(Consumer<String> listener) {
    page.onFrameNavigated(frame -> listener.accept(frame.url()));
  }

  @Override
  public void route(Consumer<InterceptedRequest> handler) throws PageActionException {
    try {
      page.route(ROUTE_ALL, route -> handler.accept(new PlaywrightRequest(route)));
    } catch (PlaywrightException ex) {
      throw translate("route", ex);
    }
  }

  @Override
  public void navigate(String url, long timeoutMs) throws PageActionException {
    try {
      page.navigate(url, new Page.NavigateOptions()
          .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
          .setTimeout(timeoutMs));
    } catch (PlaywrightException ex) {
      throw translate("navigate", ex);
    }
  }

  @Override
  public Object evaluate(String script) throws PageActionException {
    try {
      return page.evaluate(script);
    } catch (PlaywrightException ex) {
      throw translate("evaluate", ex);
    }
  }

  @Override
  public void click(String selector, int index, long timeoutMs, boolean force) throws PageActionException {
    try {
      page.locator(selector).nth(index).click(new Locator.ClickOptions()
          .setForce(force)
          .setTimeout(timeoutMs)
          .setNoWaitAfter(true));
    } catch (PlaywrightException ex) {
      throw translate("click", ex);
    }
  }

  @Override
  public void waitFor(long millis) throws PageActionException {
    try {
      page.waitForTimeout(millis);
    } catch (PlaywrightException ex) {
      throw translate("wait", ex);
    }
  }

  @Override
  public void close() {
    try {
      page.close();
    } catch (PlaywrightException ex) {
      log.debug("Page already gone while closing", ex);
    }
    try {
      browser.close();
    } catch (PlaywrightException ex) {
      log.warn("Browser did not close cleanly", ex);
    }
  }

  static PageActionException translate(String action, PlaywrightException ex) {
    String message = Objects.requireNonNullElse(ex.getMessage(), ex.getClass().getSimpleName());
    PageActionException.Kind kind;
    if (ex instanceof TimeoutError) {
      kind = PageActionException.Kind.TIMEOUT;
    } else if (message.contains("Execution context was destroyed")
        || message.contains("most likely because of a navigation")) {
      kind = PageActionException.Kind.CONTEXT_DESTROYED;
    } else {
      kind = PageActionException.Kind.OTHER;
    }
    return new PageActionException(kind, action + " failed: " + firstLine(message), ex);
  }

  private static String firstLine(String message) {
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }

  private static final class PlaywrightDialog implements DialogHandle {
    private final Dialog dialog;

    PlaywrightDialog(Dialog dialog) {
      this.dialog = dialog;
    }

    @Override
    public String type() {
      return dialog.type();
    }

    @Override
    public String message() {
      return dialog.message();
    }

    @Override
    public String defaultValue() {
      return dialog.defaultValue();
    }

    @Override
    public void accept() {
      dialog.accept();
    }

    @Override
    public void accept(String promptText) {
      dialog.accept(promptText);
    }

    @Override
    public void dismiss() {
      dialog.dismiss();
    }
  }

  private static final class PlaywrightRequest implements InterceptedRequest {
    private final Route route;

    PlaywrightRequest(Route route) {
      this.route = route;
    }

    @Override
    public String url() {
      return route.request().url();
    }

    @Override
    public String resourceType() {
      return route.request().resourceType();
    }

    @Override
    public void fulfill(int status, String contentType, String body) {
      route.fulfill(new Route.FulfillOptions().setStatus(status).setContentType(contentType).setBody(body));
    }

    @Override
    public void abort() {
      route.abort();
    }
  }
}
