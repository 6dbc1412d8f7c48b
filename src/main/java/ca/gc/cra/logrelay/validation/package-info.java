/**
 * <strong>Purpose:</strong> Validation helpers used while loading relay configuration and parsing CLI arguments.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters and malformed identifiers before they reach brokers or
 * cloud APIs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.logrelay.validation;
