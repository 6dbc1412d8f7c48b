/**
 * Command-line entry point for the relay.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, and hands the loaded
 * configuration to the composition root.</p>
 * <p><strong>Concurrency:</strong> The main thread waits for a termination signal; targets run their own workers.</p>
 */
package ca.gc.cra.logrelay.api;
