package ca.gc.cra.patmat.domain.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered group of derived values produced by {@code Keys}, {@code Attrs} and {@code Many}.
 *
 * <p>Elements may be {@code null}.</p>
 *
 * @param values element values in order
 * @since 0.1.0
 */
public record Tuple(List<Object> values) {

  /**
   * Copies the element list so later mutation of the source does not leak in.
   */
  public Tuple {
    Objects.requireNonNull(values, "values");
    values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /**
   * Builds a tuple from the supplied elements.
   *
   * @param values elements in order
   * @return immutable tuple
   */
  public static Tuple of(Object... values) {
    return new Tuple(Arrays.asList(values));
  }

  /**
   * Returns the element at {@code index}.
   *
   * @param index zero-based position
   * @return element value; may be {@code null}
   */
  public Object get(int index) {
    return values.get(index);
  }

  public int size() {
    return values.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(values.get(i));
    }
    return sb.append(')').toString();
  }
}
