/**
 * Ingestion targets: the push and pull variants behind the {@link ca.gc.cra.logrelay.application.target.Target}
 * facade, their scoped metrics, and the manager that runs them.
 * <p><strong>Concurrency:</strong> Push targets run one request per server worker thread; pull targets run a receive
 * task and a consumer task joined by a zero-capacity handoff.</p>
 * <p><strong>Metrics:</strong> Counters and gauges are recorded through
 * {@link ca.gc.cra.logrelay.application.target.TargetMetrics}.</p>
 */
package ca.gc.cra.logrelay.application.target;
