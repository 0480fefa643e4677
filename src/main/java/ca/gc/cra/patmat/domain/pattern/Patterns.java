package ca.gc.cra.patmat.domain.pattern;

import ca.gc.cra.patmat.validation.Strings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Factory for the built-in pattern variants and combinators.
 * <p><strong>Why:</strong> Keeps the concrete variant classes package-private so callers depend only on
 * {@link Pattern} and {@link Predicate}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Gates: {@link #equal}, {@link #is}, {@link #in}, {@link #type}.</li>
 *   <li>Extractors: {@link #key}, {@link #keys}, {@link #attr}, {@link #attrs}.</li>
 *   <li>Combinators: {@link #all}, {@link #any}, {@link #oneOf}, {@link #compose}, {@link #many},
 *   {@link #asPredicate}, {@link #with}, {@link #ignore}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every returned pattern is immutable and safe to share.</p>
 *
 * @since 0.1.0
 */
public final class Patterns {

  private Patterns() {
    // Utility
  }

  /**
   * Matches values equal to {@code expected} according to {@link Objects#equals(Object, Object)}.
   *
   * @param expected reference value; may be {@code null}
   * @return equality predicate
   */
  public static Predicate equal(Object expected) {
    return new ValuePredicates.Equal(expected);
  }

  /**
   * Matches exactly the {@code identity} instance.
   *
   * @param identity reference instance; may be {@code null}
   * @return identity predicate
   */
  public static Predicate is(Object identity) {
    return new ValuePredicates.Is(identity);
  }

  /**
   * Matches values contained in {@code container}. The elements are copied, so later changes to
   * {@code container} do not affect the predicate. Sets keep their membership rule: a sorted set keeps
   * its comparator.
   *
   * @param container membership set; never {@code null}
   * @return membership predicate
   */
  public static Predicate in(Collection<?> container) {
    return new ValuePredicates.In(container);
  }

  /**
   * Matches values equal to one of {@code values}.
   *
   * @param values accepted values; elements may be {@code null}
   * @return membership predicate
   */
  public static Predicate in(Object... values) {
    return new ValuePredicates.In(Arrays.asList(values.clone()));
  }

  /**
   * Matches instances of {@code type} or its subtypes. Primitive classes match their wrapper.
   *
   * @param type expected runtime type
   * @return type predicate
   */
  public static Predicate type(Class<?> type) {
    return new ValuePredicates.TypeOf(type);
  }

  /**
   * Extracts the value stored under {@code key} from a map, list, array, character sequence or
   * {@link Subscriptable}.
   *
   * @param key subscript key or integer index
   * @return extracting pattern
   */
  public static Pattern key(Object key) {
    return new Lookups.Key(key);
  }

  /**
   * Extracts several subscripts at once; the derived value is a {@link Tuple} in key order.
   *
   * @param keys subscript keys
   * @return extracting pattern
   */
  public static Pattern keys(Object... keys) {
    return new Lookups.Keys(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(keys))));
  }

  /**
   * Extracts a named attribute: record component, JavaBean getter ({@code getName()} or boolean
   * {@code isName()}) or public instance field. Other public methods are never called, nor are the
   * {@code getAndX} read-modify-write methods, so matching leaves the value unchanged.
   *
   * @param name attribute name; must not be blank
   * @return extracting pattern
   */
  public static Pattern attr(String name) {
    return new Lookups.Attr(Strings.requireNonBlank("attribute", name));
  }

  /**
   * Extracts several attributes at once; the derived value is a {@link Tuple} in name order.
   *
   * @param names attribute names; none may be blank
   * @return extracting pattern
   */
  public static Pattern attrs(String... names) {
    List<String> validated = new ArrayList<>(names.length);
    for (String name : names) {
      validated.add(Strings.requireNonBlank("attribute", name));
    }
    return new Lookups.Attrs(List.copyOf(validated));
  }

  /**
   * Succeeds when every pattern succeeds; derives the original value. Succeeds for zero patterns.
   *
   * @param patterns subpatterns evaluated for their outcome only
   * @return conjunction predicate
   */
  public static Predicate all(Pattern... patterns) {
    return new Combinators.All(copy(patterns));
  }

  /**
   * Succeeds when at least one pattern succeeds; derives the original value. Fails for zero patterns.
   *
   * @param patterns subpatterns evaluated for their outcome only
   * @return disjunction predicate
   */
  public static Predicate any(Pattern... patterns) {
    return new Combinators.Any(copy(patterns));
  }

  /**
   * Succeeds when exactly one pattern succeeds; derives the original value. Fails for zero patterns.
   *
   * @param patterns subpatterns evaluated for their outcome only
   * @return exclusive predicate
   */
  public static Predicate oneOf(Pattern... patterns) {
    return new Combinators.OneOf(copy(patterns));
  }

  /**
   * Chains patterns right to left: the last pattern sees the input, each earlier one sees the value derived
   * by its successor. {@code compose(p1, p2)} behaves as {@code p1(p2(x))}.
   *
   * @param patterns pipeline stages
   * @return composed pattern; the identity pattern when empty
   */
  public static Pattern compose(Pattern... patterns) {
    return new Combinators.Compose(copy(patterns));
  }

  /**
   * Applies every pattern to the same input and derives the {@link Tuple} of their results.
   *
   * @param patterns patterns applied in parallel
   * @return parallel pattern
   */
  public static Pattern many(Pattern... patterns) {
    return new Combinators.Many(copy(patterns));
  }

  /**
   * Gates on {@code pattern} but derives the original input.
   *
   * @param pattern gating pattern
   * @return predicate view of {@code pattern}
   */
  public static Predicate asPredicate(Pattern pattern) {
    return new Combinators.AsPredicate(Objects.requireNonNull(pattern, "pattern"));
  }

  /**
   * Derives a {@link WithMatch} holding both the input and the value derived by {@code pattern}.
   *
   * @param pattern submatch pattern
   * @return pairing pattern
   */
  public static Pattern with(Pattern pattern) {
    return new Combinators.With(Objects.requireNonNull(pattern, "pattern"));
  }

  /**
   * Wildcard that always succeeds with a {@code null} derived value.
   *
   * @return the shared wildcard pattern
   */
  public static Pattern ignore() {
    return Combinators.Ignore.INSTANCE;
  }

  /**
   * Lifts a function into a pattern that always succeeds with the function result. Exceptions thrown by the
   * function propagate.
   *
   * @param function derivation applied to the input
   * @return lifted pattern
   */
  public static Pattern of(Function<Object, ?> function) {
    return new Combinators.Lifted(Objects.requireNonNull(function, "function"));
  }

  /**
   * Lifts a boolean test into a predicate.
   *
   * @param test boolean test
   * @return predicate returning its input on success
   */
  public static Predicate predicate(java.util.function.Predicate<Object> test) {
    Objects.requireNonNull(test, "test");
    return test::test;
  }

  /**
   * Evaluates {@code pattern} against {@code value} for its outcome.
   *
   * @param value candidate value
   * @param pattern pattern to evaluate
   * @return {@code true} when the pattern matches
   */
  public static boolean matches(Object value, Pattern pattern) {
    return pattern.matches(value);
  }

  /**
   * Returns the value derived by {@code pattern}, raising when it does not match.
   *
   * @param value candidate value
   * @param pattern pattern to evaluate
   * @return derived value; may be {@code null}
   * @throws PatternMismatchException when the pattern fails
   */
  public static Object getMatch(Object value, Pattern pattern) {
    MatchResult result = pattern.attempt(value);
    if (!result.matched()) {
      throw new PatternMismatchException("Value " + value + " does not match " + pattern, value);
    }
    return result.value();
  }

  private static List<Pattern> copy(Pattern[] patterns) {
    List<Pattern> list = new ArrayList<>(patterns.length);
    for (Pattern pattern : patterns) {
      list.add(Objects.requireNonNull(pattern, "pattern"));
    }
    return List.copyOf(list);
  }
}
