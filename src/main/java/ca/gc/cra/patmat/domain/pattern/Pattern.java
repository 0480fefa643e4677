package ca.gc.cra.patmat.domain.pattern;

/**
 * <strong>What:</strong> Matching primitive: inspects a value and either derives a value from it or fails.
 * <p><strong>Why:</strong> Generic functions select implementations by running patterns over call arguments;
 * every matcher, built-in or user supplied, plugs in through this single capability.</p>
 * <p><strong>Role:</strong> Domain abstraction consumed by the combinators in {@link Patterns} and by the
 * dispatch engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return {@link MatchResult#of(Object)} with the derived value on success.</li>
 *   <li>Return {@link MatchResult#none()} on failure, converting lookup errors rather than throwing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or immutable; evaluation is repeated per
 * call from any thread.</p>
 * <p><strong>Performance:</strong> Failure is a shared singleton; no stack capture on the mismatch path.</p>
 *
 * @implNote Implementations must be referentially transparent: the same pattern and value always yield the
 * same outcome.
 * @since 0.1.0
 * @see Predicate
 * @see Patterns
 */
@FunctionalInterface
public interface Pattern {

  /**
   * Attempts to match {@code value}.
   *
   * @param value candidate value; may be {@code null}
   * @return the derived value on success, otherwise {@link MatchResult#none()}
   */
  MatchResult attempt(Object value);

  /**
   * Evaluates the pattern for its boolean outcome only.
   *
   * @param value candidate value; may be {@code null}
   * @return {@code true} when {@link #attempt(Object)} succeeds
   */
  default boolean matches(Object value) {
    return attempt(value).matched();
  }
}
