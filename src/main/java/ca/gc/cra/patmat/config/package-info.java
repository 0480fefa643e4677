/**
 * <strong>Purpose:</strong> Dispatch configuration: defaults, YAML files and {@code patmat.*} system
 * property overrides.
 *
 * @since 0.1.0
 */
package ca.gc.cra.patmat.config;
