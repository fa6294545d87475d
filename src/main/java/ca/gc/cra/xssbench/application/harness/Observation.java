package ca.gc.cra.xssbench.application.harness;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of every signal gathered for a run at one instant.
 *
 * @param javascriptUrls dangerous-URL attributes found in the DOM; only populated at the first check
 * @param hook details of the first dialog-function call, if any
 * @param dialogs dialog events as {@code dialog:<type>:<message>}
 * @param navigations navigation URLs that qualify as payload-triggered
 * @param externalScripts script URLs the page tried to fetch
 * @param externalRequests cross-origin non-script fetch attempts
 */
record Observation(
    List<JsUrlHit> javascriptUrls,
    Optional<String> hook,
    List<String> dialogs,
    List<String> navigations,
    List<String> externalScripts,
    List<ExternalRequest> externalRequests) {

  Observation {
    javascriptUrls = List.copyOf(Objects.requireNonNullElse(javascriptUrls, List.of()));
    hook = Objects.requireNonNullElse(hook, Optional.empty());
    dialogs = List.copyOf(Objects.requireNonNullElse(dialogs, List.of()));
    navigations = List.copyOf(Objects.requireNonNullElse(navigations, List.of()));
    externalScripts = List.copyOf(Objects.requireNonNullElse(externalScripts, List.of()));
    externalRequests = List.copyOf(Objects.requireNonNullElse(externalRequests, List.of()));
  }

  static Observation empty() {
    return new Observation(List.of(), Optional.empty(), List.of(), List.of(), List.of(), List.of());
  }
}
