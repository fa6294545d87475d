package ca.gc.cra.xssbench.infrastructure.browser;

import ca.gc.cra.xssbench.application.port.BrowserLaunchException;
import ca.gc.cra.xssbench.application.port.BrowserLauncher;
import ca.gc.cra.xssbench.application.port.BrowserPage;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Launches isolated browser pages through one Playwright driver.
 * <p><strong>Why:</strong> A Playwright instance and everything created from it must stay on one thread, so
 * each worker owns its own launcher.</p>
 * <p><strong>Lifecycle:</strong> The driver starts on the first launch; {@link #close()} stops it and every
 * browser it started.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class PlaywrightBrowserLauncher implements BrowserLauncher {
  private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserLauncher.class);
  private static final List<String> CHROMIUM_ARGS = List.of(
      "--disable-gpu", "--disable-dev-shm-usage", "--disable-extensions", "--mute-audio");

  private final boolean headless;
  private Playwright playwright;

  /**
   * Creates a launcher.
   *
   * @param headless whether browsers run without a window
   */
  public PlaywrightBrowserLauncher(boolean headless) {
    this.headless = headless;
  }

  @Override
  public BrowserPage launch(BrowserEngine engine) throws BrowserLaunchException {
    Browser browser = null;
    try {
      if (playwright == null) {
        playwright = Playwright.create();
      }
      BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(headless);
      if (engine == BrowserEngine.CHROMIUM) {
        options.setArgs(CHROMIUM_ARGS);
      }
      browser = browserType(engine).launch(options);
      Page page = browser.newPage();
      log.info("Launched {} {} (headless={})", engine.wireName(), browser.version(), headless);
      return new PlaywrightBrowserPage(browser, page);
    } catch (PlaywrightException ex) {
      if (browser != null) {
        closeQuietly(browser);
      }
      throw new BrowserLaunchException(engine, "Failed to launch " + engine.wireName() + ": "
          + firstLine(ex.getMessage()), ex);
    }
  }

  private BrowserType browserType(BrowserEngine engine) {
    return switch (engine) {
      case CHROMIUM -> playwright.chromium();
      case FIREFOX -> playwright.firefox();
      case WEBKIT -> playwright.webkit();
    };
  }

  @Override
  public void close() {
    if (playwright == null) {
      return;
    }
    try {
      playwright.close();
    } catch (PlaywrightException ex) {
      log.warn("Playwright driver did not stop cleanly", ex);
    } finally {
      playwright = null;
    }
  }

  private static void closeQuietly(Browser browser) {
    try {
      browser.close();
    } catch (PlaywrightException ex) {
      log.debug("Ignoring close failure of half-launched browser", ex);
    }
  }

  private static String firstLine(String message) {
    if (message == null) {
      return "unknown error";
    }
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }
}
