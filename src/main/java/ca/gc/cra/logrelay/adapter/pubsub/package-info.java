/**
 * Cloud Pub/Sub adapters for pull subscriptions.
 * <p><strong>Concurrency:</strong> Message callbacks run on client library threads; acknowledgments may be sent
 * from any thread.</p>
 * <p><strong>Security:</strong> Production connections use Application Default Credentials; emulator connections
 * are plaintext and unauthenticated.</p>
 */
package ca.gc.cra.logrelay.adapter.pubsub;
