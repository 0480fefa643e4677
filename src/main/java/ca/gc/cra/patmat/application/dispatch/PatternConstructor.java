package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.pattern.Pattern;

/**
 * Interprets one spec token of a method registration as a {@link Pattern}.
 *
 * <p>A constructor that cannot interpret a token throws {@link IllegalArgumentException}; such errors reach
 * the caller of the generic function unchanged.</p>
 *
 * @since 0.1.0
 * @see PatternConstructors
 */
@FunctionalInterface
public interface PatternConstructor {

  /**
   * Builds the pattern for {@code spec}.
   *
   * @param spec spec token as registered; may be {@code null}
   * @return pattern; never {@code null}
   */
  Pattern construct(Object spec);
}
