package ca.gc.cra.xssbench.application.port;

import java.util.function.Consumer;

/**
 * <strong>What:</strong> Host capability layer the signal-capture session needs from a browser automation
 * library.
 * <p><strong>Why:</strong> Keeps the detection protocol independent of Playwright so it can be exercised with
 * scripted fakes and so any automation layer offering the same capabilities is substitutable.</p>
 * <p><strong>Role:</strong> Outbound port implemented by {@code PlaywrightBrowserPage}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Install scripts that run before any page script.</li>
 *   <li>Intercept every request and fulfill or abort it.</li>
 *   <li>Report dialogs and frame navigations.</li>
 *   <li>Navigate, evaluate expressions and simulate trusted clicks under explicit timeouts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. A page is owned by exactly one session and driven from one
 * thread; listeners are invoked on that thread while a page call is in progress.</p>
 *
 * @since 0.1.0
 */
public interface BrowserPage extends AutoCloseable {
  /**
   * Installs a script evaluated in every document and frame before its own scripts run.
   *
   * @param script JavaScript source
   * @throws PageActionException when the browser rejects the script
   */
  void addInitScript(String script) throws PageActionException;

  /**
   * Caps the timeout applied to every page action that does not pass its own.
   *
   * @param timeoutMs timeout in milliseconds
   */
  void setDefaultTimeout(long timeoutMs);

  /**
   * Registers the dialog listener. The listener must accept or dismiss every dialog.
   *
   * @param listener dialog callback
   */
  void onDialog(Consumer<DialogHandle> listener);

  /**
   * Registers a listener receiving the URL of every committed frame navigation.
   *
   * @param listener navigation callback
   */
  void onFrameNavigated(Consumer<String> listener);

  /**
   * Routes every request through {@code handler}, which must fulfill or abort it.
   *
   * @param handler request interceptor
   * @throws PageActionException when routing cannot be installed
   */
  void route(Consumer<InterceptedRequest> handler) throws PageActionException;

  /**
   * Navigates the main frame and waits for DOMContentLoaded.
   *
   * @param url target URL
   * @param timeoutMs navigation timeout in milliseconds
   * @throws PageActionException on timeout, destroyed context or other navigation failure
   */
  void navigate(String url, long timeoutMs) throws PageActionException;

  /**
   * Evaluates an expression or function source in the main frame.
   *
   * @param script expression or {@code () => ...} function source
   * @return JSON-like value: {@code null}, {@link Boolean}, {@link Number}, {@link String},
   *     {@link java.util.List} or {@link java.util.Map}
   * @throws PageActionException when evaluation fails
   */
  Object evaluate(String script) throws PageActionException;

  /**
   * Performs a trusted click on the {@code index}-th match of {@code selector} without waiting for any
   * navigation it starts.
   *
   * @param selector CSS selector
   * @param index zero-based match index
   * @param timeoutMs action timeout in milliseconds
   * @param force skip actionability checks
   * @throws PageActionException when the click cannot be performed
   */
  void click(String selector, int index, long timeoutMs, boolean force) throws PageActionException;

  /**
   * Waits while still dispatching page events to registered listeners.
   *
   * @param millis wait duration
   * @throws PageActionException when the page fails during the wait
   */
  void waitFor(long millis) throws PageActionException;

  /**
   * Closes the page and the browser process behind it.
   */
  @Override
  void close();

  /** Dialog raised by the page. */
  interface DialogHandle {
    /** @return dialog type such as {@code alert} or {@code prompt} */
    String type();

    /** @return dialog message */
    String message();

    /** @return default prompt value, empty for other dialog types */
    String defaultValue();

    /** Accepts the dialog. */
    void accept();

    /**
     * Accepts a prompt with the given text.
     *
     * @param promptText text to answer with
     */
    void accept(String promptText);

    /** Dismisses the dialog. */
    void dismiss();
  }

  /** Request held by the interceptor until fulfilled or aborted. */
  interface InterceptedRequest {
    /** @return absolute request URL */
    String url();

    /** @return resource type such as {@code document}, {@code script} or {@code image} */
    String resourceType();

    /**
     * Responds locally without touching the network.
     *
     * @param status HTTP status
     * @param contentType response content type
     * @param body response body
     */
    void fulfill(int status, String contentType, String body);

    /** Fails the request. */
    void abort();
  }
}
