package ca.gc.cra.logrelay.infrastructure.sink;

import ca.gc.cra.logrelay.application.port.EntryPublisher;
import ca.gc.cra.logrelay.domain.entry.Entry;
import ca.gc.cra.logrelay.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes entries as INFO lines on the {@code logrelay.entries} logger. Lines are truncated to
 * {@link Logs#DEFAULT_PREVIEW_BYTES}.
 *
 * @since 0.1.0
 */
public final class LoggingEntryPublisher implements EntryPublisher {
  private static final Logger entries = LoggerFactory.getLogger("logrelay.entries");

  @Override
  public void publish(Entry entry) {
    entries.info("{} {} {}", entry.timestamp(), entry.labels().fingerprint(), Logs.preview(entry.line()));
  }
}
