/**
 * <strong>Purpose:</strong> Validation helpers used while declaring generic functions, methods and patterns.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.validation;
