package ca.gc.cra.patmat.application.dispatch;

import ca.gc.cra.patmat.domain.pattern.Pattern;
import ca.gc.cra.patmat.domain.pattern.Patterns;
import ca.gc.cra.patmat.validation.Strings;

/**
 * Built-in pattern constructors.
 *
 * <ul>
 *   <li>{@link #identity()}: patterns are used as-is, any other token means equality.</li>
 *   <li>{@link #byType()}: class tokens dispatch on the argument's runtime type.</li>
 *   <li>{@link #byKey(Object)}: tokens are compared against one subscript of the argument.</li>
 *   <li>{@link #byAttribute(String)}: tokens are compared against one named attribute of the argument.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class PatternConstructors {
  private static final PatternConstructor IDENTITY =
      spec -> spec instanceof Pattern pattern ? pattern : Patterns.equal(spec);

  private static final PatternConstructor BY_TYPE = spec -> {
    if (spec instanceof Pattern pattern) {
      return pattern;
    }
    if (spec instanceof Class<?> type) {
      return Patterns.type(type);
    }
    throw new IllegalArgumentException("Type dispatch expects a Class or Pattern spec, got: " + spec);
  };

  private PatternConstructors() {
    // Utility
  }

  /**
   * Returns the default constructor.
   *
   * @return identity constructor
   */
  public static PatternConstructor identity() {
    return IDENTITY;
  }

  /**
   * Returns a constructor turning {@link Class} tokens into type patterns.
   *
   * @return type-dispatch constructor
   */
  public static PatternConstructor byType() {
    return BY_TYPE;
  }

  /**
   * Returns a constructor that matches when the argument's subscript {@code key} equals the token. The
   * argument itself is passed on unchanged.
   *
   * @param key subscript inspected on every argument; may be {@code null}
   * @return key-dispatch constructor
   */
  public static PatternConstructor byKey(Object key) {
    Pattern lookup = Patterns.key(key);
    return spec -> Patterns.asPredicate(Patterns.compose(Patterns.equal(spec), lookup));
  }

  /**
   * Returns a constructor that matches when the argument's attribute {@code name} equals the token. The
   * argument itself is passed on unchanged.
   *
   * @param name attribute inspected on every argument
   * @return attribute-dispatch constructor
   */
  public static PatternConstructor byAttribute(String name) {
    Pattern lookup = Patterns.attr(Strings.requireNonBlank("name", name));
    return spec -> Patterns.asPredicate(Patterns.compose(Patterns.equal(spec), lookup));
  }
}
