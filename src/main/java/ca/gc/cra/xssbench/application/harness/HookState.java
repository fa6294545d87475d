package ca.gc.cra.xssbench.application.harness;

import java.util.Map;
import java.util.Optional;

/**
 * Per-run snapshot of the page's dialog-function hook, read through the evaluation boundary.
 *
 * @param executed whether {@code alert}, {@code confirm} or {@code prompt} was called
 * @param details {@code <function>:<first argument>} of the first call
 */
record HookState(boolean executed, String details) {
  static final HookState NOT_FIRED = new HookState(false, "");

  /**
   * Converts the value returned by {@link PageScripts#HOOK_STATE}.
   *
   * @param evaluated map with {@code executed} and {@code details}
   * @return snapshot; {@link #NOT_FIRED} for unexpected values
   */
  static HookState fromEvaluated(Object evaluated) {
    if (!(evaluated instanceof Map<?, ?> map)) {
      return NOT_FIRED;
    }
    boolean executed = Boolean.TRUE.equals(map.get("executed"));
    Object details = map.get("details");
    return new HookState(executed, details == null ? "" : details.toString());
  }

  Optional<String> firedDetails() {
    return executed ? Optional.of(details) : Optional.empty();
  }
}
