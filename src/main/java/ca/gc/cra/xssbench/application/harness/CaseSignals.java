package ca.gc.cra.xssbench.application.harness;

import ca.gc.cra.xssbench.application.render.DocumentRenderer;
import ca.gc.cra.xssbench.domain.vector.PayloadContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Signal buffers filled by the page listeners during one run.
 *
 * <p>Listeners fire on the session thread while a page call is in flight, but every method is synchronized so
 * the buffers stay consistent even with automation layers that dispatch from their own threads.</p>
 */
final class CaseSignals {
  private static final String BASE_URL = DocumentRenderer.BASE_URL;

  private final List<String> navigations = new ArrayList<>();
  private final List<String> externalScripts = new ArrayList<>();
  private final List<ExternalRequest> externalRequests = new ArrayList<>();
  private final List<String> dialogs = new ArrayList<>();
  private int baseNavigationCount;

  synchronized void reset() {
    navigations.clear();
    externalScripts.clear();
    externalRequests.clear();
    dialogs.clear();
    baseNavigationCount = 0;
  }

  /**
   * Records a committed frame navigation. The first navigation to the base URL is the case's own load; any
   * later one is a reload caused by the payload.
   */
  synchronized void frameNavigated(String url) {
    if (url == null || url.isEmpty() || url.startsWith(BASE_URL + "#")) {
      return;
    }
    if (url.equals(BASE_URL)) {
      baseNavigationCount++;
      if (baseNavigationCount > 1) {
        navigations.add(url);
      }
      return;
    }
    navigations.add(url);
  }

  synchronized void documentRequested(String url) {
    navigations.add(url);
  }

  synchronized void scriptRequested(String url) {
    externalScripts.add(url);
  }

  synchronized void resourceRequested(String resourceType, String url) {
    externalRequests.add(new ExternalRequest(resourceType == null ? "" : resourceType, url));
  }

  synchronized void dialogOpened(String details) {
    dialogs.add(details);
  }

  /**
   * Discards base-URL navigations left over from the previous case's in-flight reload and marks the
   * case's own load as seen.
   */
  synchronized void initialLoadCompleted() {
    navigations.removeIf(BASE_URL::equals);
    if (baseNavigationCount < 1) {
      baseNavigationCount = 1;
    }
  }

  synchronized boolean hasNavigations() {
    return !navigations.isEmpty();
  }

  /**
   * Snapshots the buffers.
   *
   * @param context rendered context, used to drop the harness's own href click
   * @param expectedClickUrl resolved anchor target clicked in href context; may be {@code null}
   * @param javascriptUrls dangerous-URL hits to include
   * @param hook hook snapshot to include
   * @return immutable observation
   */
  synchronized Observation observe(
      PayloadContext context, String expectedClickUrl, List<JsUrlHit> javascriptUrls, HookState hook) {
    List<String> qualifying = new ArrayList<>();
    for (String url : navigations) {
      if (isIgnorable(url)) {
        continue;
      }
      if (context == PayloadContext.HREF && expectedClickUrl != null && !expectedClickUrl.isEmpty()
          && url.equals(expectedClickUrl)) {
        continue;
      }
      qualifying.add(url);
    }
    return new Observation(
        javascriptUrls,
        hook.firedDetails(),
        dialogs,
        qualifying,
        externalScripts,
        externalRequests);
  }

  private static boolean isIgnorable(String url) {
    return url == null
        || url.isEmpty()
        || url.startsWith("chrome-error://")
        || url.equals("about:blank")
        || url.startsWith("about:srcdoc")
        || url.startsWith(BASE_URL + "#");
  }
}
