/**
 * Prometheus-compatible relabel rules applied to entry labels.
 * <p><strong>Concurrency:</strong> Rules are immutable and {@link ca.gc.cra.logrelay.domain.relabel.Relabeler} is stateless.</p>
 */
package ca.gc.cra.logrelay.domain.relabel;
