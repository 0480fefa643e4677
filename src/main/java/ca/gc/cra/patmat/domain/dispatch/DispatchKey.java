package ca.gc.cra.patmat.domain.dispatch;

import ca.gc.cra.patmat.logging.Logs;
import ca.gc.cra.patmat.validation.Strings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Registry key of one method: the positional spec tokens in order plus the keyword spec tokens sorted by
 * keyword name.
 *
 * <p>Two registrations with equal keys address the same registry slot. Spec tokens are opaque here; only
 * the generic function's pattern constructor interprets them.</p>
 *
 * @param positional positional spec tokens; elements may be {@code null}
 * @param keywords keyword spec tokens ordered by name
 * @since 0.1.0
 */
public record DispatchKey(List<Object> positional, List<KeywordSpec> keywords) {

  /**
   * Copies the token lists and sorts keyword specs by name.
   */
  public DispatchKey {
    positional = positional == null
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(positional));
    List<KeywordSpec> sorted = keywords == null ? new ArrayList<>() : new ArrayList<>(keywords);
    sorted.sort(Comparator.comparing(KeywordSpec::name));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).name().equals(sorted.get(i - 1).name())) {
        throw new IllegalArgumentException("Duplicate keyword spec: " + sorted.get(i).name());
      }
    }
    keywords = List.copyOf(sorted);
  }

  /**
   * Builds a key from positional tokens and a keyword-name to token mapping.
   *
   * @param positional positional spec tokens; may be {@code null} for none
   * @param keywords keyword spec tokens; may be {@code null} for none
   * @return dispatch key
   */
  public static DispatchKey of(List<?> positional, Map<String, ?> keywords) {
    List<KeywordSpec> specs = new ArrayList<>();
    if (keywords != null) {
      for (Map.Entry<String, ?> entry : keywords.entrySet()) {
        specs.add(new KeywordSpec(entry.getKey(), entry.getValue()));
      }
    }
    return new DispatchKey(positional == null ? null : new ArrayList<>(positional), specs);
  }

  /**
   * Builds a key from positional tokens only.
   *
   * @param positional positional spec tokens
   * @return dispatch key without keyword specs
   */
  public static DispatchKey positional(Object... positional) {
    return of(Arrays.asList(positional), Map.of());
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    for (Object token : positional) {
      joiner.add(Logs.describe(token));
    }
    for (KeywordSpec spec : keywords) {
      joiner.add(spec.name() + "=" + Logs.describe(spec.spec()));
    }
    return joiner.toString();
  }

  /**
   * Spec token attached to a keyword argument name.
   *
   * @param name keyword argument name; never blank
   * @param spec spec token; may be {@code null}
   */
  public record KeywordSpec(String name, Object spec) {
    /**
     * Validates the keyword name.
     */
    public KeywordSpec {
      name = Strings.requireNonBlank("keyword", name);
    }
  }
}
