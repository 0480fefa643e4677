package ca.gc.cra.patmat.domain.pattern;

/**
 * Opt-in subscript access for value types that are neither maps, lists, arrays nor character sequences.
 *
 * <p>{@code Key} patterns call {@link #subscript(Object)} and treat a thrown {@link RuntimeException} the same
 * way as an absent key.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Subscriptable {

  /**
   * Looks up {@code key}.
   *
   * @param key subscript key
   * @return the value stored under {@code key}, or {@link MatchResult#none()} when absent
   */
  MatchResult subscript(Object key);
}
