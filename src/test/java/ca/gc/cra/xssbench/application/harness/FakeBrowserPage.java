package ca.gc.cra.xssbench.application.harness;

import ca.gc.cra.xssbench.application.port.BrowserPage;
import ca.gc.cra.xssbench.application.port.PageActionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Scripted {@link BrowserPage}. Payload behaviour is simulated through the {@link Action} hooks, which fire
 * the same listener callbacks a real engine would.
 */
final class FakeBrowserPage implements BrowserPage {

  @FunctionalInterface
  interface Action {
    void apply(FakeBrowserPage page) throws PageActionException;
  }

  final List<String> initScripts = new ArrayList<>();
  final List<String> evaluated = new ArrayList<>();
  final List<String> navigatedTo = new ArrayList<>();
  final List<String> clicks = new ArrayList<>();
  final List<Long> waits = new ArrayList<>();
  long defaultTimeout;
  int closeCount;
  String servedDocument;

  Action onNavigateStart = page -> {};
  Action onLoad = page -> {};
  Action onTrigger = page -> {};
  Action onClick = page -> {};
  Action onWait = page -> {};
  PageActionException navigateFailure;
  Object javascriptUrls;
  Object hrefTarget;
  Object linkIndices;
  ManualClock clock;

  private Map<String, Object> hook = Map.of("executed", false, "details", "");
  private Consumer<DialogHandle> dialogListener = dialog -> {};
  private Consumer<String> navigationListener = url -> {};
  private Consumer<InterceptedRequest> routeHandler = request -> {};

  @Override
  public void addInitScript(String script) {
    initScripts.add(script);
  }

  @Override
  public void setDefaultTimeout(long timeoutMs) {
    defaultTimeout = timeoutMs;
  }

  @Override
  public void onDialog(Consumer<DialogHandle> listener) {
    dialogListener = listener;
  }

  @Override
  public void onFrameNavigated(Consumer<String> listener) {
    navigationListener = listener;
  }

  @Override
  public void route(Consumer<InterceptedRequest> handler) {
    routeHandler = handler;
  }

  @Override
  public void navigate(String url, long timeoutMs) throws PageActionException {
    navigatedTo.add(url);
    hook = Map.of("executed", false, "details", "");
    onNavigateStart.apply(this);
    if (navigateFailure != null) {
      onLoad.apply(this);
      throw navigateFailure;
    }
    FakeRequest document = request("document", url);
    servedDocument = document.body;
    navigated(url);
    onLoad.apply(this);
  }

  @Override
  public Object evaluate(String script) throws PageActionException {
    evaluated.add(script);
    if (script.equals(PageScripts.HOOK_STATE)) {
      return hook;
    }
    if (script.equals(PageScripts.DETECT_JAVASCRIPT_URLS)) {
      return javascriptUrls;
    }
    if (script.equals(PageScripts.HREF_TARGET)) {
      return hrefTarget;
    }
    if (script.equals(PageScripts.JAVASCRIPT_LINK_INDICES)) {
      return linkIndices;
    }
    if (script.equals(PageScripts.TRIGGER_EVENTS)) {
      onTrigger.apply(this);
    }
    return null;
  }

  @Override
  public void click(String selector, int index, long timeoutMs, boolean force) throws PageActionException {
    clicks.add(selector + "#" + index);
    onClick.apply(this);
  }

  @Override
  public void waitFor(long millis) throws PageActionException {
    waits.add(millis);
    if (clock != null) {
      clock.advance(millis);
    }
    onWait.apply(this);
  }

  @Override
  public void close() {
    closeCount++;
  }

  int evaluations(String script) {
    int count = 0;
    for (String candidate : evaluated) {
      if (candidate.equals(script)) {
        count++;
      }
    }
    return count;
  }

  void hookFired(String details) {
    hook = Map.of("executed", true, "details", details);
  }

  void navigated(String url) {
    navigationListener.accept(url);
  }

  FakeDialog dialog(String type, String message, String defaultValue) {
    return dialog(new FakeDialog(type, message, defaultValue));
  }

  FakeDialog dialog(FakeDialog dialog) {
    dialogListener.accept(dialog);
    return dialog;
  }

  FakeRequest request(String resourceType, String url) {
    return request(new FakeRequest(resourceType, url));
  }

  FakeRequest request(FakeRequest request) {
    routeHandler.accept(request);
    return request;
  }

  static final class FakeDialog implements DialogHandle {
    private final String type;
    private final String message;
    private final String defaultValue;
    boolean failAccept;
    boolean accepted;
    boolean dismissed;
    String promptText;

    FakeDialog(String type, String message, String defaultValue) {
      this.type = type;
      this.message = message;
      this.defaultValue = defaultValue;
    }

    @Override
    public String type() {
      return type;
    }

    @Override
    public String message() {
      return message;
    }

    @Override
    public String defaultValue() {
      return defaultValue;
    }

    @Override
    public void accept() {
      if (failAccept) {
        throw new IllegalStateException("dialog already handled");
      }
      accepted = true;
    }

    @Override
    public void accept(String promptText) {
      accept();
      this.promptText = promptText;
    }

    @Override
    public void dismiss() {
      dismissed = true;
    }
  }

  static final class FakeRequest implements InterceptedRequest {
    private final String resourceType;
    private final String url;
    int status;
    String body;
    boolean aborted;
    RuntimeException fulfillFailure;
    RuntimeException abortFailure;

    FakeRequest(String resourceType, String url) {
      this.resourceType = resourceType;
      this.url = url;
    }

    @Override
    public String url() {
      return url;
    }

    @Override
    public String resourceType() {
      return resourceType;
    }

    @Override
    public void fulfill(int status, String contentType, String body) {
      if (fulfillFailure != null) {
        throw fulfillFailure;
      }
      this.status = status;
      this.body = body;
    }

    @Override
    public void abort() {
      if (abortFailure != null) {
        throw abortFailure;
      }
      aborted = true;
    }
  }
}
