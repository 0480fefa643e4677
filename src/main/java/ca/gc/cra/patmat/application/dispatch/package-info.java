/**
 * <strong>Purpose:</strong> Generic functions and the machinery that dispatches their calls: method registry,
 * dispatch engine, pattern constructors and method combiners.
 * <p><strong>Concurrency:</strong> Registries publish immutable snapshots; registration and dispatch may
 * interleave freely.
 * <p><strong>Observability:</strong> Loggers live under {@code ca.gc.cra.patmat.application.dispatch}; see
 * {@link ca.gc.cra.patmat.logging.LoggingConfigurator#enableDispatchTracing()}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.application.dispatch;
