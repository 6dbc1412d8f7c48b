package ca.gc.cra.logrelay.application.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.logrelay.config.TargetConfig;
import ca.gc.cra.logrelay.domain.entry.LabelSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TargetManagerTest {

  private static TargetConfig pull(String job) {
    return TargetConfig.pull(job, "project", "sub-" + job, LabelSet.of("job", job));
  }

  @Test
  void startsTargetsInOrderAndExposesThem() throws IOException {
    List<StubTarget> created = new ArrayList<>();
    TargetManager manager = TargetManager.start(List.of(pull("a"), pull("b")), config -> {
      StubTarget target = new StubTarget(config.staticLabels(), true);
      created.add(target);
      return target;
    });

    assertEquals(List.of("a", "b"), manager.jobNames());
    assertEquals(2, manager.targets().size());
    assertSame(created.get(1), manager.target("b"));
    assertThrows(UnsupportedOperationException.class, () -> manager.targets().clear());
    assertTrue(manager.ready());
  }

  @Test
  void readyWhenAnyTargetIsReady() throws IOException {
    TargetManager none = TargetManager.start(List.of(pull("a")), config -> new StubTarget(LabelSet.empty(), false));
    assertFalse(none.ready());

    List<Boolean> readiness = new ArrayList<>(List.of(false, true));
    TargetManager one = TargetManager.start(
        List.of(pull("a"), pull("b")), config -> new StubTarget(LabelSet.empty(), readiness.remove(0)));
    assertTrue(one.ready());
  }

  @Test
  void duplicateJobNamesAreRejectedBeforeAnyTargetStarts() {
    List<TargetConfig> configs = List.of(pull("a"), pull("a"));
    List<TargetConfig> seen = new ArrayList<>();

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
        () -> TargetManager.start(configs, config -> {
          seen.add(config);
          return new StubTarget(LabelSet.empty(), true);
        }));

    assertTrue(thrown.getMessage().contains("duplicate job_name: a"));
    assertTrue(seen.isEmpty());
  }

  @Test
  void failedCreationStopsTargetsAlreadyStarted() {
    StubTarget first = new StubTarget(LabelSet.empty(), true);

    IOException thrown = assertThrows(IOException.class,
        () -> TargetManager.start(List.of(pull("a"), pull("b")), config -> {
          if (config.jobName().equals("b")) {
            throw new IOException("bind failed");
          }
          return first;
        }));

    assertEquals("bind failed", thrown.getMessage());
    assertEquals(1, first.stops);
  }

  @Test
  void stopStopsEveryTargetAndRethrowsFirstFailure() throws IOException {
    StubTarget failing = new StubTarget(LabelSet.empty(), true);
    failing.failure = new TargetStopException("first", new IOException("boom"));
    StubTarget alsoFailing = new StubTarget(LabelSet.empty(), true);
    alsoFailing.failure = new TargetStopException("second", new IOException("bang"));
    StubTarget healthy = new StubTarget(LabelSet.empty(), true);
    List<StubTarget> targets = new ArrayList<>(List.of(failing, healthy, alsoFailing));
    TargetManager manager =
        TargetManager.start(List.of(pull("a"), pull("b"), pull("c")), config -> targets.remove(0));

    TargetStopException thrown = assertThrows(TargetStopException.class, manager::stop);

    assertEquals("first", thrown.getMessage());
    assertEquals(1, thrown.getSuppressed().length);
    assertEquals(1, failing.stops);
    assertEquals(1, healthy.stops);
    assertEquals(1, alsoFailing.stops);
  }

  private static final class StubTarget implements Target {
    private final LabelSet labels;
    private final boolean ready;
    int stops;
    RuntimeException failure;

    StubTarget(LabelSet labels, boolean ready) {
      this.labels = labels;
      this.ready = ready;
    }

    @Override
    public TargetType type() {
      return TargetType.GCPLOG;
    }

    @Override
    public LabelSet labels() {
      return labels;
    }

    @Override
    public LabelSet discoveredLabels() {
      return LabelSet.empty();
    }

    @Override
    public boolean ready() {
      return ready;
    }

    @Override
    public Map<String, String> details() {
      return Map.of();
    }

    @Override
    public void stop() {
      stops++;
      if (failure != null) {
        throw failure;
      }
    }
  }
}
