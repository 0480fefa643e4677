package ca.gc.cra.patmat.domain.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Structural composition of patterns. Combinators only ever call {@link Pattern#attempt(Object)} on their
 * parts, so user-defined patterns compose exactly like the built-in ones.
 *
 * @since 0.1.0
 */
final class Combinators {

  private Combinators() {
    // Utility
  }

  static final class All implements Predicate {
    private final List<Pattern> patterns;

    All(List<Pattern> patterns) {
      this.patterns = patterns;
    }

    @Override
    public boolean test(Object value) {
      for (Pattern pattern : patterns) {
        if (!pattern.matches(value)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return "All" + patterns;
    }
  }

  static final class Any implements Predicate {
    private final List<Pattern> patterns;

    Any(List<Pattern> patterns) {
      this.patterns = patterns;
    }

    @Override
    public boolean test(Object value) {
      for (Pattern pattern : patterns) {
        if (pattern.matches(value)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return "Any" + patterns;
    }
  }

  static final class OneOf implements Predicate {
    private final List<Pattern> patterns;

    OneOf(List<Pattern> patterns) {
      this.patterns = patterns;
    }

    @Override
    public boolean test(Object value) {
      int successes = 0;
      for (Pattern pattern : patterns) {
        if (pattern.matches(value) && ++successes > 1) {
          return false;
        }
      }
      return successes == 1;
    }

    @Override
    public String toString() {
      return "OneOf" + patterns;
    }
  }

  static final class Compose implements Pattern {
    private final List<Pattern> patterns;

    Compose(List<Pattern> patterns) {
      this.patterns = patterns;
    }

    @Override
    public MatchResult attempt(Object value) {
      MatchResult current = MatchResult.of(value);
      for (int i = patterns.size() - 1; i >= 0 && current.matched(); i--) {
        current = patterns.get(i).attempt(current.value());
      }
      return current;
    }

    @Override
    public String toString() {
      return "Compose" + patterns;
    }
  }

  static final class Many implements Pattern {
    private final List<Pattern> patterns;

    Many(List<Pattern> patterns) {
      this.patterns = patterns;
    }

    @Override
    public MatchResult attempt(Object value) {
      List<Object> results = new ArrayList<>(patterns.size());
      for (Pattern pattern : patterns) {
        MatchResult result = pattern.attempt(value);
        if (!result.matched()) {
          return result;
        }
        results.add(result.value());
      }
      return MatchResult.of(new Tuple(results));
    }

    @Override
    public String toString() {
      return "Many" + patterns;
    }
  }

  static final class AsPredicate implements Predicate {
    private final Pattern pattern;

    AsPredicate(Pattern pattern) {
      this.pattern = pattern;
    }

    @Override
    public boolean test(Object value) {
      return pattern.matches(value);
    }

    @Override
    public String toString() {
      return "AsPredicate(" + pattern + ")";
    }
  }

  static final class With implements Pattern {
    private final Pattern pattern;

    With(Pattern pattern) {
      this.pattern = pattern;
    }

    @Override
    public MatchResult attempt(Object value) {
      return pattern.attempt(value).map(match -> new WithMatch(value, match));
    }

    @Override
    public String toString() {
      return "With(" + pattern + ")";
    }
  }

  static final class Ignore implements Pattern {
    static final Ignore INSTANCE = new Ignore();

    private static final MatchResult NOTHING = MatchResult.of(null);

    private Ignore() {}

    @Override
    public MatchResult attempt(Object value) {
      return NOTHING;
    }

    @Override
    public String toString() {
      return "Ignore";
    }
  }

  static final class Lifted implements Pattern {
    private final Function<Object, ?> function;

    Lifted(Function<Object, ?> function) {
      this.function = function;
    }

    @Override
    public MatchResult attempt(Object value) {
      return MatchResult.of(function.apply(value));
    }

    @Override
    public String toString() {
      return "Pattern(" + function + ")";
    }
  }
}
