package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.dispatch.Candidate;
import ca.gc.cra.patmat.domain.dispatch.DispatchCall;
import java.util.stream.Stream;

/**
 * Turns the candidate sequence of one call into the generic function's result.
 *
 * <p>Implementations decide how many candidates to consume and must throw
 * {@link DispatchCall#noApplicableMethod()} when the sequence is empty.</p>
 *
 * @param <V> result type of the registered implementations
 * @param <R> result type of the generic function
 * @since 0.1.0
 * @see MethodCombiners
 */
@FunctionalInterface
public interface MethodCombiner<V, R> {

  /**
   * Combines the candidates of {@code call}.
   *
   * @param call identity of the call, used for failure reporting
   * @param candidates lazy candidate stream in registration order
   * @return combined result
   * @throws ca.gc.cra.patmat.domain.dispatch.DispatchFailure when no candidate applies
   */
  R combine(DispatchCall call, Stream<Candidate<V>> candidates);
}
