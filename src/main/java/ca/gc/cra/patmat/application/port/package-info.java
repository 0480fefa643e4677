/**
 * <strong>Purpose:</strong> Ports the dispatch layer calls out through.
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.application.port;
