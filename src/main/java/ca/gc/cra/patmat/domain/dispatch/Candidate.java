package ca.gc.cra.patmat.domain.dispatch;

import java.util.Objects;

/**
 * Method whose patterns all matched one call, paired with the arguments to invoke it with.
 *
 * <p>Candidates live for one dispatch only and are never cached.</p>
 *
 * @param key registry key of the matched method
 * @param implementation matched method body
 * @param arguments call arguments with each matched argument replaced by its derived value
 * @param <V> result type
 * @since 0.1.0
 */
public record Candidate<V>(DispatchKey key, Implementation<V> implementation, CallArguments arguments) {

  /**
   * Validates that all components are present.
   */
  public Candidate {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(implementation, "implementation");
    Objects.requireNonNull(arguments, "arguments");
  }

  /**
   * Invokes the implementation with the transformed arguments.
   *
   * @return implementation result
   */
  public V invoke() {
    return implementation.invoke(arguments);
  }
}
