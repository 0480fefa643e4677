/**
 * Value types shared by the dispatch engine: call arguments, registry keys, candidates and dispatch failures.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.domain.dispatch;
