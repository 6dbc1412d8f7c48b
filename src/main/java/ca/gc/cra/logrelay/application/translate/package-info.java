/**
 * Translation of push and pull envelopes into log entries.
 * <p><strong>Role:</strong> Application core shared by both ingestion modes.</p>
 * <p><strong>Concurrency:</strong> Parser and translator are stateless and thread-safe.</p>
 * <p><strong>Security:</strong> Payloads are decoded strictly; malformed input is rejected rather than repaired.</p>
 */
package ca.gc.cra.logrelay.application.translate;
