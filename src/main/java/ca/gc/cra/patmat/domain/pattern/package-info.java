/**
 * <strong>Purpose:</strong> Pattern algebra: matchers that inspect a value and derive a value from it, plus
 * the combinators that compose them.
 * <p><strong>Concurrency:</strong> Every pattern is immutable and safe to evaluate from any thread.
 * <p><strong>Errors:</strong> Mismatch is reported as {@link ca.gc.cra.patmat.domain.pattern.MatchResult#none()},
 * never by throwing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.domain.pattern;
