package ca.gc.cra.patmat.domain.pattern;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Equality, identity, membership and type gates. Each returns its input unchanged on success.
 *
 * @since 0.1.0
 */
final class ValuePredicates {
  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      char.class, Character.class,
      short.class, Short.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class,
      void.class, Void.class);

  private ValuePredicates() {
    // Utility
  }

  static final class Equal implements Predicate {
    private final Object expected;

    Equal(Object expected) {
      this.expected = expected;
    }

    @Override
    public boolean test(Object value) {
      return Objects.equals(expected, value);
    }

    @Override
    public String toString() {
      return "Equal(" + expected + ")";
    }
  }

  static final class Is implements Predicate {
    private final Object identity;

    Is(Object identity) {
      this.identity = identity;
    }

    @Override
    public boolean test(Object value) {
      return value == identity;
    }

    @Override
    public String toString() {
      return "Is(" + identity + ")";
    }
  }

  static final class In implements Predicate {
    private final Collection<?> container;

    In(Collection<?> container) {
      this.container = snapshot(Objects.requireNonNull(container, "container"));
    }

    private static Collection<?> snapshot(Collection<?> container) {
      if (container instanceof SortedSet<?> sorted) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sorted));
      }
      if (container instanceof Set<?> set) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(set));
      }
      return Collections.unmodifiableList(new ArrayList<>(container));
    }

    @Override
    public boolean test(Object value) {
      try {
        return container.contains(value);
      } catch (NullPointerException | ClassCastException ex) {
        // Immutable collections reject null and foreign element types instead of answering false.
        return false;
      }
    }

    @Override
    public String toString() {
      return "In(" + container + ")";
    }
  }

  static final class TypeOf implements Predicate {
    private final Class<?> type;

    TypeOf(Class<?> type) {
      Objects.requireNonNull(type, "type");
      this.type = type.isPrimitive() ? WRAPPERS.get(type) : type;
    }

    @Override
    public boolean test(Object value) {
      return type.isInstance(value);
    }

    @Override
    public String toString() {
      return "Type(" + type.getSimpleName() + ")";
    }
  }
}
