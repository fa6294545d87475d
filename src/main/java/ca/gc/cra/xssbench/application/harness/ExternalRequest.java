package ca.gc.cra.xssbench.application.harness;

/**
 * Intercepted cross-origin non-script request.
 *
 * @param resourceType browser resource type such as {@code image} or {@code stylesheet}
 * @param url absolute URL
 */
record ExternalRequest(String resourceType, String url) {}
