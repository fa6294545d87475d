package ca.gc.cra.xssbench.application.harness;

import ca.gc.cra.xssbench.application.port.BrowserPage;
import ca.gc.cra.xssbench.application.port.BrowserPage.DialogHandle;
import ca.gc.cra.xssbench.application.port.BrowserPage.InterceptedRequest;
import ca.gc.cra.xssbench.application.port.CancellationToken;
import ca.gc.cra.xssbench.application.port.ClockPort;
import ca.gc.cra.xssbench.application.port.ExecutionHarness;
import ca.gc.cra.xssbench.application.port.HarnessException;
import ca.gc.cra.xssbench.application.port.MetricsPort;
import ca.gc.cra.xssbench.application.port.PageActionException;
import ca.gc.cra.xssbench.application.render.DocumentRenderer;
import ca.gc.cra.xssbench.domain.bench.BrowserEngine;
import ca.gc.cra.xssbench.domain.harness.CaseRequest;
import ca.gc.cra.xssbench.domain.harness.VectorResult;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.logging.Logs;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns one browser page and runs cases against it, one at a time.
 * <p><strong>Why:</strong> Launching a browser per case is far too slow, so a session is reused across
 * thousands of cases. Every run therefore starts by cancelling timers the previous payload left behind and
 * clearing the signal buffers.</p>
 * <p><strong>Role:</strong> {@link ExecutionHarness} implementation built on the {@link BrowserPage} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Install the prelude hook, dialog handler, navigation listener and request interceptor once.</li>
 *   <li>Serve the rendered document at {@link DocumentRenderer#BASE_URL}; abort every other request.</li>
 *   <li>Walk each run through {@link RunPhase} and let {@link ExecutionClassifier} name the verdict.</li>
 * </ul>
 * <p><strong>Lifecycle:</strong> {@code IDLE -> RUNNING -> IDLE} per case, {@code CLOSED} after
 * {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by exactly one worker.</p>
 * <p><strong>Observability:</strong> Emits {@code harness.run.latencyMs} and
 * {@code harness.navigation.timeout}; phase transitions log at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class SignalCaptureSession implements ExecutionHarness {
  private static final Logger log = LoggerFactory.getLogger(SignalCaptureSession.class);
  private static final String BASE_URL = DocumentRenderer.BASE_URL;
  private static final URI BASE_URI = URI.create(BASE_URL);
  private static final int LOG_PAYLOAD_BYTES = 160;

  enum State {
    IDLE,
    RUNNING,
    CLOSED
  }

  private final BrowserPage page;
  private final BrowserEngine engine;
  private final SessionSettings settings;
  private final DocumentRenderer renderer;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CaseSignals signals = new CaseSignals();

  private volatile String currentDocument = "";
  private State state = State.IDLE;

  private SignalCaptureSession(
      BrowserPage page,
      BrowserEngine engine,
      SessionSettings settings,
      DocumentRenderer renderer,
      MetricsPort metrics,
      ClockPort clock) {
    this.page = Objects.requireNonNull(page, "page");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.clock = Objects.requireNonNullElse(clock, ClockPort.SYSTEM);
  }

  /**
   * Instruments a freshly launched page and returns an idle session that owns it.
   *
   * @param page page to instrument; closed by {@link #close()}
   * @param engine engine behind the page, for logs
   * @param settings action timeout and polling interval
   * @param metrics metrics sink
   * @param clock time source for the wait window
   * @return idle session
   * @throws PageActionException when instrumentation cannot be installed
   */
  public static SignalCaptureSession open(
      BrowserPage page,
      BrowserEngine engine,
      SessionSettings settings,
      MetricsPort metrics,
      ClockPort clock) throws PageActionException {
    SignalCaptureSession session =
        new SignalCaptureSession(page, engine, settings, new DocumentRenderer(), metrics, clock);
    session.install();
    log.info("Signal capture session ready for {}", engine.wireName());
    return session;
  }

  private void install() throws PageActionException {
    page.addInitScript(PageScripts.PRELUDE);
    page.setDefaultTimeout(settings.actionTimeoutMs());
    page.onDialog(this::handleDialog);
    page.onFrameNavigated(signals::frameNavigated);
    page.route(this::intercept);
  }

  /**
   * Runs one case through the phases of {@link RunPhase}.
   *
   * @param request case input
   * @param token run-wide cancellation, checked while polling
   * @return verdict
   * @throws HarnessException when a page action fails without an execution signal to explain it
   * @throws IllegalStateException when the session is closed or already running
   */
  @Override
  public VectorResult run(CaseRequest request, CancellationToken token) throws HarnessException {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(token, "token");
    if (state != State.IDLE) {
      throw new IllegalStateException("Session for " + engine.wireName() + " is " + state);
    }
    state = State.RUNNING;
    long start = clock.nowMillis();
    try {
      return new CaseRun(request, token).execute();
    } finally {
      metrics.observe("harness.run.latencyMs", clock.nowMillis() - start);
      if (state == State.RUNNING) {
        state = State.IDLE;
      }
    }
  }

  State state() {
    return state;
  }

  String currentDocument() {
    return currentDocument;
  }

  @Override
  public void close() {
    if (state == State.CLOSED) {
      return;
    }
    state = State.CLOSED;
    try {
      page.close();
      log.info("Signal capture session for {} closed", engine.wireName());
    } catch (RuntimeException ex) {
      log.warn("Failed to close {} page cleanly", engine.wireName(), ex);
    }
  }

  private void handleDialog(DialogHandle dialog) {
    String type = "";
    String details;
    try {
      type = Objects.requireNonNullElse(dialog.type(), "");
      details = "dialog:" + type + ":" + Objects.requireNonNullElse(dialog.message(), "");
    } catch (RuntimeException ex) {
      details = "dialog";
    }
    signals.dialogOpened(details);
    // Unhandled dialogs block the page.
    try {
      if (type.equals("prompt")) {
        dialog.accept(Objects.requireNonNullElse(dialog.defaultValue(), ""));
      } else {
        dialog.accept();
      }
    } catch (RuntimeException acceptFailure) {
      log.warn("Accepting {} dialog failed; dismissing", type, acceptFailure);
      try {
        dialog.dismiss();
      } catch (RuntimeException dismissFailure) {
        log.warn("Dismissing {} dialog failed", type, dismissFailure);
      }
    }
  }

  private void intercept(InterceptedRequest request) {
    String url = Objects.requireNonNullElse(request.url(), "");
    String type = Objects.requireNonNullElse(request.resourceType(), "");
    try {
      if (type.equals("document") && url.equals(BASE_URL)) {
        request.fulfill(200, "text/html", currentDocument);
        return;
      }
      boolean http = url.startsWith("http://") || url.startsWith("https://");
      if (type.equals("document")) {
        signals.documentRequested(url);
      } else if (type.equals("script")) {
        if (http) {
          signals.scriptRequested(url);
        }
      } else if (http && !isSameOrigin(url)) {
        signals.resourceRequested(type, url);
      }
      request.abort();
    } catch (RuntimeException ex) {
      log.warn("Request interception failed for {} {}; aborting", type, url, ex);
      try {
        request.abort();
      } catch (RuntimeException abortFailure) {
        log.debug("Abort of {} {} failed: {}", type, url, abortFailure.getMessage());
      }
    }
  }

  static boolean isSameOrigin(String url) {
    try {
      URI uri = new URI(url);
      return uri.getScheme() != null
          && uri.getScheme().toLowerCase(Locale.ROOT).equals(BASE_URI.getScheme())
          && uri.getRawAuthority() != null
          && uri.getRawAuthority().toLowerCase(Locale.ROOT).equals(BASE_URI.getRawAuthority());
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private record Step(RunPhase next, VectorResult verdict) {
    static Step advance(RunPhase next) {
      return new Step(next, null);
    }

    static Step done(VectorResult verdict) {
      return new Step(null, verdict);
    }
  }

  /** State of one run; discarded when the run returns. */
  private final class CaseRun {
    private final CaseRequest request;
    private final CancellationToken token;
    private final PayloadContext context;
    private final ExecutionClassifier classifier;
    private String expectedClickUrl;

    private CaseRun(CaseRequest request, CancellationToken token) {
      this.request = request;
      this.token = token;
      this.context = request.context();
      this.classifier = new ExecutionClassifier(context, request.payloadHtml());
    }

    VectorResult execute() throws HarnessException {
      RunPhase phase = RunPhase.NAVIGATING;
      while (true) {
        log.debug("{} {} phase {}", engine.wireName(), context.wireName(), phase);
        Step step = switch (phase) {
          case NAVIGATING -> navigate();
          case SIGNAL_CHECK -> signalCheck();
          case EVENT_TRIGGER -> triggerEvents();
          case POLL_WAIT -> pollWait();
          case FINAL_CHECK -> Step.done(classifier.finalVerdict(observe()));
        };
        if (step.verdict() != null) {
          log.debug("{} verdict after {}: {}", engine.wireName(), phase,
              Logs.truncate(step.verdict().details(), LOG_PAYLOAD_BYTES));
          return step.verdict();
        }
        phase = step.next();
      }
    }

    private Step navigate() throws HarnessException {
      try {
        page.evaluate(PageScripts.CLEANUP);
      } catch (PageActionException ex) {
        log.debug("Timer cleanup before case failed on {}: {}", engine.wireName(), ex.getMessage());
      }
      signals.reset();
      currentDocument = renderer.render(request.sanitizedHtml(), context);
      try {
        page.navigate(BASE_URL, settings.actionTimeoutMs());
      } catch (PageActionException ex) {
        switch (ex.kind()) {
          case TIMEOUT -> {
            metrics.increment("harness.navigation.timeout");
            return Step.done(classifier.afterNavigationTimeout(observeWithoutHook()));
          }
          case CONTEXT_DESTROYED -> {
            return Step.done(classifier.contextDestroyed());
          }
          default -> throw new HarnessException("Navigation failed: " + ex.getMessage(), ex);
        }
      }
      signals.initialLoadCompleted();
      return Step.advance(RunPhase.SIGNAL_CHECK);
    }

    private Step signalCheck() {
      List<JsUrlHit> hits;
      try {
        hits = JsUrlHit.fromEvaluated(page.evaluate(PageScripts.DETECT_JAVASCRIPT_URLS));
      } catch (PageActionException ex) {
        log.debug("javascript: URL scan failed on {}: {}", engine.wireName(), ex.getMessage());
        hits = List.of();
      }
      Observation observation = signals.observe(context, expectedClickUrl, hits, readHook());
      return classifier.checkExecution(observation)
          .map(Step::done)
          .orElseGet(() -> Step.advance(RunPhase.EVENT_TRIGGER));
    }

    private Step triggerEvents() throws HarnessException {
      if (context == PayloadContext.HREF) {
        clickAnchor();
      } else {
        try {
          page.evaluate(PageScripts.TRIGGER_EVENTS);
        } catch (PageActionException ex) {
          Optional<VectorResult> navigated = classifier.checkNavigation(observeWithoutHook());
          if (navigated.isPresent()) {
            return Step.done(navigated.get());
          }
          if (ex.kind() == PageActionException.Kind.CONTEXT_DESTROYED) {
            return Step.done(classifier.contextDestroyed());
          }
          throw new HarnessException("Event trigger failed: " + ex.getMessage(), ex);
        }
      }
      Optional<String> hook = readHook().firedDetails();
      if (hook.isPresent()) {
        return Step.done(classifier.checkExecution(observe()).orElseThrow());
      }
      if (context != PayloadContext.HREF) {
        clickJavascriptLinks();
        if (context.isHttpLeak()) {
          try {
            page.evaluate(PageScripts.EXTERNAL_REQUEST_GESTURES);
          } catch (PageActionException ex) {
            log.debug("Request gestures failed on {}: {}", engine.wireName(), ex.getMessage());
          }
        }
      }
      Observation observation = observeWithoutHook();
      Optional<VectorResult> verdict = classifier.checkNavigation(observation);
      if (verdict.isEmpty() && context.isHttpLeak()) {
        verdict = classifier.checkLeak(observation);
      }
      return verdict.map(Step::done).orElseGet(() -> Step.advance(RunPhase.POLL_WAIT));
    }

    private Step pollWait() throws HarnessException {
      if (request.timeoutMs() <= 0) {
        return Step.advance(RunPhase.FINAL_CHECK);
      }
      long deadline = clock.nowMillis() + request.timeoutMs();
      while (true) {
        if (token.isCancelled()) {
          log.debug("Wait window on {} cut short: {}", engine.wireName(), token.reason());
          break;
        }
        Observation observation = observe();
        Optional<VectorResult> verdict = classifier.checkExecution(observation);
        if (verdict.isEmpty() && context.isHttpLeak()) {
          verdict = classifier.checkLeak(observation);
        }
        if (verdict.isPresent()) {
          return Step.done(verdict.get());
        }
        long remaining = deadline - clock.nowMillis();
        if (remaining <= 0) {
          break;
        }
        try {
          page.waitFor(Math.min(settings.pollIntervalMs(), remaining));
        } catch (PageActionException ex) {
          Optional<VectorResult> navigated = classifier.checkNavigation(observeWithoutHook());
          if (navigated.isPresent()) {
            return Step.done(navigated.get());
          }
          if (ex.kind() == PageActionException.Kind.CONTEXT_DESTROYED) {
            return Step.done(classifier.contextDestroyed());
          }
          throw new HarnessException("Wait failed: " + ex.getMessage(), ex);
        }
      }
      return Step.advance(RunPhase.FINAL_CHECK);
    }

    private void clickAnchor() {
      try {
        Object target = page.evaluate(PageScripts.HREF_TARGET);
        expectedClickUrl = target == null ? null : target.toString();
      } catch (PageActionException ex) {
        expectedClickUrl = null;
      }
      // javascript: URLs need a trusted gesture in some engines.
      try {
        page.click(PageScripts.HREF_LINK_SELECTOR, 0, clickTimeoutMs(), false);
      } catch (PageActionException ex) {
        log.debug("Anchor click failed on {}: {}", engine.wireName(), ex.getMessage());
      }
    }

    private void clickJavascriptLinks() {
      Object indices;
      try {
        indices = page.evaluate(PageScripts.JAVASCRIPT_LINK_INDICES);
      } catch (PageActionException ex) {
        log.debug("javascript: link lookup failed on {}: {}", engine.wireName(), ex.getMessage());
        return;
      }
      if (!(indices instanceof List<?> list)) {
        return;
      }
      for (Object index : list) {
        if (!(index instanceof Number number)) {
          continue;
        }
        try {
          page.click(PageScripts.LINK_SELECTOR, number.intValue(), clickTimeoutMs(), true);
        } catch (PageActionException ex) {
          log.debug("javascript: link click {} failed on {}: {}", number, engine.wireName(), ex.getMessage());
        }
      }
    }

    private long clickTimeoutMs() {
      long timeout = request.timeoutMs();
      return timeout > 0 ? Math.min(timeout, settings.actionTimeoutMs()) : settings.actionTimeoutMs();
    }

    private Observation observe() {
      return signals.observe(context, expectedClickUrl, List.of(), readHook());
    }

    private Observation observeWithoutHook() {
      return signals.observe(context, expectedClickUrl, List.of(), HookState.NOT_FIRED);
    }

    private HookState readHook() {
      try {
        return HookState.fromEvaluated(page.evaluate(PageScripts.HOOK_STATE));
      } catch (PageActionException ex) {
        log.debug("Hook read failed on {}: {}", engine.wireName(), ex.getMessage());
        return HookState.NOT_FIRED;
      }
    }
  }
}
