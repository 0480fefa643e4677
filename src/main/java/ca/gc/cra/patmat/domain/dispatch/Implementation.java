package ca.gc.cra.patmat.domain.dispatch;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Method body registered under a generic function. Receives the call arguments after each matched argument
 * has been replaced by the value its pattern derived.
 *
 * <p>Exceptions thrown by an implementation propagate unchanged to the caller of the generic function.</p>
 *
 * @param <V> result type
 * @since 0.1.0
 */
@FunctionalInterface
public interface Implementation<V> {

  /**
   * Runs the method body.
   *
   * @param arguments transformed call arguments
   * @return method result; may be {@code null}
   */
  V invoke(CallArguments arguments);

  /**
   * Adapts a function that ignores its arguments.
   *
   * @param body result supplier
   * @param <V> result type
   * @return implementation
   */
  static <V> Implementation<V> nullary(Supplier<? extends V> body) {
    Objects.requireNonNull(body, "body");
    return arguments -> body.get();
  }

  /**
   * Adapts a function of the first positional argument.
   *
   * @param body function of argument 0
   * @param <V> result type
   * @return implementation
   */
  static <V> Implementation<V> unary(Function<Object, ? extends V> body) {
    Objects.requireNonNull(body, "body");
    return arguments -> body.apply(arguments.get(0));
  }

  /**
   * Adapts a function of the first two positional arguments.
   *
   * @param body function of arguments 0 and 1
   * @param <V> result type
   * @return implementation
   */
  static <V> Implementation<V> binary(BiFunction<Object, Object, ? extends V> body) {
    Objects.requireNonNull(body, "body");
    return arguments -> body.apply(arguments.get(0), arguments.get(1));
  }
}
