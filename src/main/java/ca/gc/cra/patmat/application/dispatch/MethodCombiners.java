package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.dispatch.Candidate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Built-in method combiners. Each one throws a dispatch failure when no method applies.
 *
 * @since 0.1.0
 */
public final class MethodCombiners {

  private MethodCombiners() {
    // Utility
  }

  /**
   * Invokes the first applicable method only; later methods are never evaluated.
   *
   * @param <V> result type
   * @return apply-first combiner
   */
  public static <V> MethodCombiner<V, V> first() {
    return (call, candidates) -> candidates
        .findFirst()
        .orElseThrow(call::noApplicableMethod)
        .invoke();
  }

  /**
   * Evaluates every method and invokes the last applicable one.
   *
   * @param <V> result type
   * @return apply-last combiner
   */
  public static <V> MethodCombiner<V, V> last() {
    return (call, candidates) -> {
      Candidate<V> last = null;
      Iterator<Candidate<V>> iterator = candidates.iterator();
      while (iterator.hasNext()) {
        last = iterator.next();
      }
      if (last == null) {
        throw call.noApplicableMethod();
      }
      return last.invoke();
    };
  }

  /**
   * Invokes every applicable method in registration order.
   *
   * @param <V> result type
   * @return apply-all combiner producing the list of results; elements may be {@code null}
   */
  public static <V> MethodCombiner<V, List<V>> all() {
    return (call, candidates) -> {
      List<V> results = new ArrayList<>();
      Iterator<Candidate<V>> iterator = candidates.iterator();
      while (iterator.hasNext()) {
        results.add(iterator.next().invoke());
      }
      if (results.isEmpty()) {
        throw call.noApplicableMethod();
      }
      return Collections.unmodifiableList(results);
    };
  }

  /**
   * Invokes every applicable method and left-folds the results with {@code op}, seeded with the first result.
   *
   * @param op binary fold operation
   * @param <V> result type
   * @return apply-reduce combiner
   */
  public static <V> MethodCombiner<V, V> reduce(BinaryOperator<V> op) {
    Objects.requireNonNull(op, "op");
    MethodCombiner<V, List<V>> all = all();
    return (call, candidates) -> {
      List<V> results = all.combine(call, candidates);
      V accumulator = results.get(0);
      for (int i = 1; i < results.size(); i++) {
        accumulator = op.apply(accumulator, results.get(i));
      }
      return accumulator;
    };
  }
}
