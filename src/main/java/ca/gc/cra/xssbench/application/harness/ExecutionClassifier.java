package ca.gc.cra.xssbench.application.harness;

import ca.gc.cra.xssbench.domain.harness.VectorResult;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import ca.gc.cra.xssbench.logging.Logs;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns the signals gathered for one run into a verdict.
 * <p><strong>Why:</strong> Signals race and none is reliable alone, so a fixed precedence decides which one
 * explains the run:
 * <ol>
 *   <li>{@code javascript:} URL attribute in the DOM</li>
 *   <li>dialog-function hook fired</li>
 *   <li>dialog event</li>
 *   <li>qualifying navigation (execution outside leak contexts)</li>
 *   <li>script fetch attempt</li>
 *   <li>qualifying navigation in a leak context (leak, as a {@code document} fetch)</li>
 *   <li>cross-origin non-script fetch attempt (leak)</li>
 * </ol>
 * Script fetches outrank every leak signal.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 */
final class ExecutionClassifier {
  private static final int MAX_URLS = 3;

  private final PayloadContext context;
  private final String payloadHtml;

  ExecutionClassifier(PayloadContext context, String payloadHtml) {
    this.context = Objects.requireNonNull(context, "context");
    this.payloadHtml = Objects.requireNonNull(payloadHtml, "payloadHtml");
  }

  /**
   * Applies the precedence up to and including script fetches, plus navigation leaks.
   *
   * @param observation current signals
   * @return decisive verdict, or empty when only passive leaks (or nothing) were seen
   */
  Optional<VectorResult> checkExecution(Observation observation) {
    if (!observation.javascriptUrls().isEmpty()) {
      return Optional.of(executed("dangerous-url:" + observation.javascriptUrls().get(0).describe()));
    }
    if (observation.hook().isPresent()) {
      return Optional.of(executed("hook:" + observation.hook().get()));
    }
    if (!observation.dialogs().isEmpty()) {
      return Optional.of(executed(observation.dialogs().get(0)));
    }
    if (!context.isHttpLeak() && !observation.navigations().isEmpty()) {
      return Optional.of(executed("navigation:" + firstUrls(observation.navigations())));
    }
    if (!observation.externalScripts().isEmpty()) {
      return Optional.of(executed("external-script:" + firstUrls(observation.externalScripts())));
    }
    if (context.isHttpLeak() && !observation.navigations().isEmpty()) {
      return Optional.of(leak("document", firstUrls(observation.navigations())));
    }
    return Optional.empty();
  }

  /**
   * Classifies navigations alone, used when a page action failed because the payload navigated.
   *
   * @param observation current signals
   * @return navigation verdict, or empty when no qualifying navigation was seen
   */
  Optional<VectorResult> checkNavigation(Observation observation) {
    if (observation.navigations().isEmpty()) {
      return Optional.empty();
    }
    String urls = firstUrls(observation.navigations());
    return Optional.of(context.isHttpLeak() ? leak("document", urls) : executed("navigation:" + urls));
  }

  /**
   * Classifies passive cross-origin fetches.
   *
   * @param observation current signals
   * @return leak verdict for the first fetch, or empty
   */
  Optional<VectorResult> checkLeak(Observation observation) {
    if (observation.externalRequests().isEmpty()) {
      return Optional.empty();
    }
    ExternalRequest first = observation.externalRequests().get(0);
    return Optional.of(leak(first.resourceType(), first.url()));
  }

  /**
   * Final verdict once the wait window is over.
   *
   * @param observation signals at the deadline
   * @return execution, leak or pass
   */
  VectorResult finalVerdict(Observation observation) {
    return checkExecution(observation)
        .or(() -> checkLeak(observation))
        .orElseGet(VectorResult::pass);
  }

  /**
   * Verdict when loading the synthetic document timed out. A load that never settles is itself treated as
   * payload-driven navigation unless a more specific signal explains it.
   *
   * @param observation signals gathered before the timeout
   * @return execution or leak verdict; never pass
   */
  VectorResult afterNavigationTimeout(Observation observation) {
    return checkExecution(observation)
        .or(() -> checkLeak(observation))
        .orElseGet(() -> executed("navigation:goto-timeout"));
  }

  /**
   * Verdict when the payload's own navigation destroyed the evaluation context.
   *
   * @return execution verdict
   */
  VectorResult contextDestroyed() {
    return executed("navigation:context-destroyed");
  }

  private VectorResult executed(String kind) {
    return VectorResult.executed("Executed: " + kind + "; payload=" + Logs.quote(payloadHtml));
  }

  private VectorResult leak(String resourceType, String urls) {
    return VectorResult.leak("External fetch: " + resourceType + ":" + urls + "; payload=" + Logs.quote(payloadHtml));
  }

  private static String firstUrls(List<String> urls) {
    return String.join(", ", urls.subList(0, Math.min(MAX_URLS, urls.size())));
  }
}
