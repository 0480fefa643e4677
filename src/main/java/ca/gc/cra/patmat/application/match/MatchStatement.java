package ca.gc.cra.patmat.application.match;

import ca.gc.cra.patmat.domain.pattern.MatchResult;
import ca.gc.cra.patmat.domain.pattern.Pattern;
import ca.gc.cra.patmat.domain.pattern.PatternMismatchException;
import ca.gc.cra.patmat.logging.Logs;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Ordered case analysis over a single value.
 *
 * <pre>{@code
 * String kind = MatchStatement.<String>on(shape)
 *     .when(Patterns.key("radius"), radius -> "circle of " + radius)
 *     .when(Patterns.keys("w", "h"), size -> "rectangle " + size)
 *     .otherwise(value -> "unknown");
 * }</pre>
 *
 * <p>Cases are tried in order; the handler of the first matching case runs with the value its pattern
 * derived and later cases are skipped. Instances are single-use and not thread-safe.</p>
 *
 * @param <R> result type of the handlers
 * @since 0.1.0
 */
public final class MatchStatement<R> {
  private final Object value;
  private boolean matched;
  private R result;

  private MatchStatement(Object value) {
    this.value = value;
  }

  /**
   * Starts a match over {@code value}.
   *
   * @param value value to analyse; may be {@code null}
   * @param <R> result type
   * @return statement without cases
   */
  public static <R> MatchStatement<R> on(Object value) {
    return new MatchStatement<>(value);
  }

  public Object value() {
    return value;
  }

  /**
   * Adds a case.
   *
   * @param pattern case pattern
   * @param handler receives the derived value when this is the first matching case
   * @return this statement
   */
  public MatchStatement<R> when(Pattern pattern, Function<Object, ? extends R> handler) {
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(handler, "handler");
    if (matched) {
      return this;
    }
    MatchResult outcome = pattern.attempt(value);
    if (outcome.matched()) {
      matched = true;
      result = handler.apply(outcome.value());
    }
    return this;
  }

  /**
   * Adds a case that matches any value without binding it.
   *
   * @param handler runs when no earlier case matched
   * @return this statement
   */
  public MatchStatement<R> ignore(Supplier<? extends R> handler) {
    Objects.requireNonNull(handler, "handler");
    if (!matched) {
      matched = true;
      result = handler.get();
    }
    return this;
  }

  /**
   * Completes the statement with a default handler.
   *
   * @param handler receives the original value when no case matched
   * @return result of the matching case or of {@code handler}
   */
  public R otherwise(Function<Object, ? extends R> handler) {
    Objects.requireNonNull(handler, "handler");
    return matched ? result : handler.apply(value);
  }

  /**
   * Completes the statement without a default.
   *
   * @return result of the matching case; may be {@code null}
   * @throws PatternMismatchException when no case matched
   */
  public R result() {
    if (!matched) {
      throw new PatternMismatchException("No pattern matches value " + Logs.describe(value), value);
    }
    return result;
  }

  public boolean isMatched() {
    return matched;
  }
}
