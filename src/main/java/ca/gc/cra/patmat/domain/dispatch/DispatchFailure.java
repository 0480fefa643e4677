package ca.gc.cra.patmat.domain.dispatch;

import ca.gc.cra.patmat.logging.Logs;
import java.util.Objects;

/**
 * Raised when no registered method of a generic function matches a call.
 *
 * <p>Carries the generic function's name and the actual call arguments. Ordinary per-method mismatches never
 * surface as this exception; it is only raised once the whole candidate sequence turned out empty.</p>
 *
 * @since 0.1.0
 */
public final class DispatchFailure extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient DispatchCall call;

  DispatchFailure(DispatchCall call) {
    super(message(Objects.requireNonNull(call, "call")));
    this.call = call;
  }

  /**
   * Returns the name of the generic function that failed to dispatch.
   *
   * @return generic function name
   */
  public String genericName() {
    return call.genericName();
  }

  /**
   * Returns the actual arguments of the failed call.
   *
   * @return call arguments
   */
  public CallArguments arguments() {
    return call.arguments();
  }

  /**
   * Returns the call this failure belongs to.
   *
   * @return failed call
   */
  public DispatchCall call() {
    return call;
  }

  private static String message(DispatchCall call) {
    return "No method of generic function '" + call.genericName() + "' matches arguments "
        + Logs.truncate(call.arguments().toString(), call.maxDiagnosticBytes());
  }
}
