/**
 * Case analysis over a single value using patterns.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.application.match;
