package ca.gc.cra.patmat.domain.dispatch;

import java.util.Locale;

/**
 * Decides what happens when a call supplies fewer positional arguments than a method declares spec tokens.
 *
 * <p>Surplus arguments beyond the declared tokens always pass through unmatched, whatever the policy.</p>
 *
 * @since 0.1.0
 */
public enum ArityPolicy {
  /** Trailing spec tokens without an argument are not evaluated; the method may still match. */
  LENIENT,

  /** A method declaring more positional spec tokens than the call supplies does not match. */
  STRICT;

  /**
   * Parses a policy name case-insensitively.
   *
   * @param raw policy name; blank yields {@link #LENIENT}
   * @return parsed policy
   * @throws IllegalArgumentException for unknown names
   */
  public static ArityPolicy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return LENIENT;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "lenient" -> LENIENT;
      case "strict" -> STRICT;
      default -> throw new IllegalArgumentException("Unknown arity policy: " + raw);
    };
  }
}
