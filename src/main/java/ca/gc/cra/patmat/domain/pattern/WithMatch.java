package ca.gc.cra.patmat.domain.pattern;

/**
 * Pair produced by {@code Patterns.with(...)}: the raw input together with the submatch derived from it.
 *
 * @param value original input value
 * @param match value derived by the wrapped pattern
 * @since 0.1.0
 */
public record WithMatch(Object value, Object match) {}
