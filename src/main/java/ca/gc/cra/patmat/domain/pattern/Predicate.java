package ca.gc.cra.patmat.domain.pattern;

/**
 * Pattern whose outcome depends only on a boolean test and which returns its input unchanged on success.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Predicate extends Pattern {

  /**
   * Tests the candidate value.
   *
   * @param value candidate value; may be {@code null}
   * @return {@code true} when the value satisfies the predicate
   */
  boolean test(Object value);

  @Override
  default MatchResult attempt(Object value) {
    return test(value) ? MatchResult.of(value) : MatchResult.none();
  }
}
