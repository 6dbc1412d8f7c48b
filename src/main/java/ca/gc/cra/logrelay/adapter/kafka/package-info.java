/**
 * Kafka publisher for translated entries.
 * <p><strong>Concurrency:</strong> Shares one thread-safe producer across all sinks.</p>
 * <p><strong>Security:</strong> Bootstrap servers and topics are validated before the producer is created.</p>
 */
package ca.gc.cra.logrelay.adapter.kafka;
