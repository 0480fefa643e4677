package ca.gc.cra.patmat.domain.pattern;

/**
 * Raised when a caller explicitly demands a match that did not happen.
 *
 * <p>Only {@link Patterns#getMatch(Object, Pattern)} and match statements raise it; ordinary pattern
 * evaluation reports failure through {@link MatchResult#none()}.</p>
 *
 * @since 0.1.0
 */
public final class PatternMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Object value;

  /**
   * Creates an exception describing the unmatched value.
   *
   * @param message diagnostic message
   * @param value value that failed to match; may be {@code null}
   */
  public PatternMismatchException(String message, Object value) {
    super(message);
    this.value = value;
  }

  /**
   * Returns the value that failed to match.
   *
   * @return unmatched value; may be {@code null}
   */
  public Object value() {
    return value;
  }
}
