package ca.gc.cra.patmat.domain.dispatch;

import ca.gc.cra.patmat.logging.Logs;
import ca.gc.cra.patmat.validation.Strings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Actual arguments of one generic-function call: positional values plus named keyword values.
 *
 * <p><strong>Thread-safety:</strong> Immutable; argument values may be {@code null}.</p>
 *
 * @param positional positional argument values in call order
 * @param keywords keyword argument values keyed by name, in call order
 * @since 0.1.0
 */
public record CallArguments(List<Object> positional, Map<String, Object> keywords) {
  private static final CallArguments EMPTY = new CallArguments(List.of(), Map.of());

  /**
   * Copies both collections so the record stays immutable while still accepting {@code null} values.
   */
  public CallArguments {
    positional = positional == null
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(positional));
    keywords = keywords == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
  }

  /**
   * Builds positional-only arguments.
   *
   * @param values positional values; a {@code null} array means no arguments
   * @return immutable call arguments
   */
  public static CallArguments of(Object... values) {
    if (values == null || values.length == 0) {
      return EMPTY;
    }
    return new CallArguments(Arrays.asList(values), Map.of());
  }

  /**
   * Starts a builder for mixed positional and keyword arguments.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return positional.size();
  }

  /**
   * Indicates that neither positional nor keyword arguments were supplied.
   *
   * @return {@code true} for an empty call
   */
  public boolean isEmpty() {
    return positional.isEmpty() && keywords.isEmpty();
  }

  /**
   * Returns the positional argument at {@code index}.
   *
   * @param index zero-based position
   * @return argument value; may be {@code null}
   * @throws IndexOutOfBoundsException when fewer arguments were supplied
   */
  public Object get(int index) {
    return positional.get(index);
  }

  /**
   * Indicates whether a keyword argument named {@code name} was supplied, even with a {@code null} value.
   *
   * @param name keyword name
   * @return {@code true} when present
   */
  public boolean hasKeyword(String name) {
    return keywords.containsKey(name);
  }

  /**
   * Returns the keyword argument named {@code name}.
   *
   * @param name keyword name
   * @return argument value, or {@code null} when absent
   */
  public Object keyword(String name) {
    return keywords.get(name);
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "(", ")");
    for (Object value : positional) {
      joiner.add(Logs.describe(value));
    }
    for (Map.Entry<String, Object> entry : keywords.entrySet()) {
      joiner.add(entry.getKey() + "=" + Logs.describe(entry.getValue()));
    }
    return joiner.toString();
  }

  /** Mutable builder for {@link CallArguments}. */
  public static final class Builder {
    private final List<Object> positional = new ArrayList<>();
    private final Map<String, Object> keywords = new LinkedHashMap<>();

    private Builder() {}

    /**
     * Appends a positional argument.
     *
     * @param value argument value; may be {@code null}
     * @return this builder
     */
    public Builder add(Object value) {
      positional.add(value);
      return this;
    }

    /**
     * Appends several positional arguments.
     *
     * @param values argument values
     * @return this builder
     */
    public Builder addAll(Object... values) {
      positional.addAll(Arrays.asList(values));
      return this;
    }

    /**
     * Sets a keyword argument, replacing any earlier value for the same name.
     *
     * @param name keyword name; must not be blank
     * @param value argument value; may be {@code null}
     * @return this builder
     */
    public Builder keyword(String name, Object value) {
      keywords.put(Strings.requireNonBlank("keyword", name), value);
      return this;
    }

    public CallArguments build() {
      return new CallArguments(positional, keywords);
    }
  }
}
