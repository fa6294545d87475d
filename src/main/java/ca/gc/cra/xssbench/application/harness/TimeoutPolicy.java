package ca.gc.cra.xssbench.application.harness;

import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Chooses the post-trigger wait window for a case.
 *
 * <p>Most payloads fire synchronously, so the window is zero unless the payload or its sanitized output
 * schedules work for later.</p>
 *
 * @since 0.1.0
 */
public final class TimeoutPolicy {
  /** Window for timer, animation-frame and promise payloads. */
  public static final long DEFERRED_SCRIPT_MS = 250;
  /** Window for meta-refresh payloads. */
  public static final long META_REFRESH_MS = 400;
  /** Window for inline {@code onload}/{@code onerror} handlers. */
  public static final long LOAD_HANDLER_MS = 25;

  private static final String[] DEFERRED_TOKENS = {
      "settimeout", "setinterval", "requestanimationframe", "promiseresolve",
      "new promise", "async ", "await "
  };
  private static final Pattern LOAD_HANDLER = Pattern.compile("\\bon(load|error)\\s*=");

  private TimeoutPolicy() {}

  /**
   * Resolves the window, preferring a caller-supplied fixed value.
   *
   * @param fixedMs fixed window; empty selects the adaptive window
   * @param payloadHtml raw payload
   * @param sanitizedHtml sanitizer output
   * @return window in milliseconds
   */
  public static long resolve(OptionalLong fixedMs, String payloadHtml, String sanitizedHtml) {
    if (fixedMs.isPresent()) {
      return fixedMs.getAsLong();
    }
    return adaptive(payloadHtml, sanitizedHtml);
  }

  /**
   * Infers the window from payload content.
   *
   * @param payloadHtml raw payload
   * @param sanitizedHtml sanitizer output
   * @return 250, 400, 25 or 0 milliseconds
   */
  public static long adaptive(String payloadHtml, String sanitizedHtml) {
    String blob = (payloadHtml + "\n" + sanitizedHtml).toLowerCase(Locale.ROOT);
    for (String token : DEFERRED_TOKENS) {
      if (blob.contains(token)) {
        return DEFERRED_SCRIPT_MS;
      }
    }
    if (blob.contains("http-equiv") && blob.contains("refresh")) {
      return META_REFRESH_MS;
    }
    if (LOAD_HANDLER.matcher(blob).find()) {
      return LOAD_HANDLER_MS;
    }
    return 0;
  }
}
