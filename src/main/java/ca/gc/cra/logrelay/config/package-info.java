/**
 * Relay configuration records, the YAML loader, and the composition root that wires adapters into targets.
 * <p><strong>Role:</strong> Bootstrap layer invoked once by the CLI.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; loading runs on the main thread.</p>
 * <p><strong>Security:</strong> Values are validated before any socket or subscription is opened.</p>
 */
package ca.gc.cra.logrelay.config;
