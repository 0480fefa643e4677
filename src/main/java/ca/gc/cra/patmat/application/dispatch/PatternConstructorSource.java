package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.dispatch.CallArguments;
import java.util.Optional;

/**
 * Computes the pattern constructor for one call from that call's arguments.
 *
 * <p>An empty result selects {@link PatternConstructors#identity()}.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PatternConstructorSource {

  /**
   * Resolves the constructor for the call.
   *
   * @param arguments actual call arguments
   * @return constructor to use, or empty for the identity constructor
   */
  Optional<PatternConstructor> resolve(CallArguments arguments);
}
