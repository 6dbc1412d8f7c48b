/**
 * Netty HTTP listener for Pub/Sub push deliveries.
 * <p><strong>Concurrency:</strong> I/O runs on Netty event loops; endpoint calls run on a separate executor group
 * sized by {@code server.worker_threads}.</p>
 * <p><strong>Security:</strong> Plain HTTP; terminate TLS and authenticate push requests in front of the relay.</p>
 */
package ca.gc.cra.logrelay.adapter.http;
