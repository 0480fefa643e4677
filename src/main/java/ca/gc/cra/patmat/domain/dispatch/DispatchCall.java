package ca.gc.cra.patmat.domain.dispatch;

import java.util.Objects;

/**
 * Identity of one generic-function invocation, handed to method combiners so they can report a
 * {@link DispatchFailure} naming the generic and its actual arguments.
 *
 * @param genericName name of the invoked generic function
 * @param arguments actual (untransformed) call arguments
 * @param maxDiagnosticBytes byte budget for the argument rendering in failure messages
 * @since 0.1.0
 */
public record DispatchCall(String genericName, CallArguments arguments, int maxDiagnosticBytes) {

  /**
   * Validates components.
   */
  public DispatchCall {
    Objects.requireNonNull(genericName, "genericName");
    Objects.requireNonNull(arguments, "arguments");
    if (maxDiagnosticBytes <= 0) {
      throw new IllegalArgumentException("maxDiagnosticBytes must be positive");
    }
  }

  /**
   * Creates the failure reported when no registered method applies to this call.
   *
   * @return dispatch failure bound to this call
   */
  public DispatchFailure noApplicableMethod() {
    return new DispatchFailure(this);
  }
}
