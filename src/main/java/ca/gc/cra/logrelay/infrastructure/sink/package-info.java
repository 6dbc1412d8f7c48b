/**
 * Queued entry sink and the log publisher.
 * <p><strong>Concurrency:</strong> Each sink owns one worker thread; publishers are shared across sinks and must be
 * thread-safe.</p>
 * <p><strong>Metrics:</strong> {@code sink.entries.published} and {@code sink.entries.failed}, by {@code sink}.</p>
 */
package ca.gc.cra.logrelay.infrastructure.sink;
