package ca.gc.cra.patmat.domain.pattern;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single {@link Pattern#attempt(Object)} evaluation.
 *
 * <p>A successful match carries the derived value, which may legitimately be {@code null}; a failed match
 * is the shared {@link NoMatch#INSTANCE} singleton and carries nothing.</p>
 *
 * @since 0.1.0
 */
public sealed interface MatchResult permits MatchResult.Matched, MatchResult.NoMatch {

  /**
   * Creates a successful result.
   *
   * @param value derived value; may be {@code null}
   * @return successful result wrapping {@code value}
   */
  static MatchResult of(Object value) {
    return new Matched(value);
  }

  /**
   * Returns the failed result.
   *
   * @return the {@link NoMatch} singleton
   */
  static MatchResult none() {
    return NoMatch.INSTANCE;
  }

  /**
   * Indicates whether the pattern succeeded.
   *
   * @return {@code true} for {@link Matched}
   */
  boolean matched();

  /**
   * Returns the derived value of a successful match.
   *
   * @return derived value; may be {@code null}
   * @throws IllegalStateException when called on a failed result
   */
  Object value();

  /**
   * Transforms the derived value of a successful match.
   *
   * @param mapper transformation applied to the derived value
   * @return mapped result, or this failure unchanged
   */
  default MatchResult map(Function<Object, ?> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return matched() ? of(mapper.apply(value())) : this;
  }

  /**
   * Feeds the derived value of a successful match into another pattern.
   *
   * @param next pattern applied to the derived value
   * @return the next pattern's result, or this failure unchanged
   */
  default MatchResult then(Pattern next) {
    Objects.requireNonNull(next, "next");
    return matched() ? next.attempt(value()) : this;
  }

  /**
   * Returns the derived value, or {@code fallback} when the match failed.
   *
   * @param fallback value returned on failure
   * @return derived value or fallback
   */
  default Object orElse(Object fallback) {
    return matched() ? value() : fallback;
  }

  /** Successful match carrying the derived value. */
  record Matched(Object value) implements MatchResult {
    @Override
    public boolean matched() {
      return true;
    }
  }

  /** Failed match. */
  enum NoMatch implements MatchResult {
    INSTANCE;

    @Override
    public boolean matched() {
      return false;
    }

    @Override
    public Object value() {
      throw new IllegalStateException("No value: pattern did not match");
    }

    @Override
    public String toString() {
      return "NoMatch";
    }
  }
}
