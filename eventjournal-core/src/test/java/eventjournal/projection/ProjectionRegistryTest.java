package eventjournal.projection;

import eventjournal.dlq.RedriveResult;
import eventjournal.journal.EventJournal;
import eventjournal.model.DeadLetterSummary;
import eventjournal.model.StreamState;
import eventjournal.support.InMemoryCheckpointStore;
import eventjournal.support.InMemoryDeadLetterStore;
import eventjournal.support.InMemoryJournalStore;
import eventjournal.support.RecordingProjection;
import eventjournal.support.TestConnections;
import eventjournal.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectionRegistryTest {

  private EventJournal journal;
  private InMemoryCheckpointStore checkpoints;
  private InMemoryDeadLetterStore deadLetters;

  @BeforeEach
  void setUp() {
    journal = EventJournal.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .store(new InMemoryJournalStore())
        .build();
    checkpoints = new InMemoryCheckpointStore();
    deadLetters = new InMemoryDeadLetterStore();
  }

  private ProjectionRegistry newRegistry() {
    return ProjectionRegistry.builder()
        .connectionProvider(TestConnections.dummyProvider())
        .journal(journal)
        .checkpoints(checkpoints)
        .deadLetterStore(deadLetters)
        .build();
  }

  @Test
  void registersFirstVersionAsActive() {
    ProjectionRegistry registry = newRegistry();

    ProjectionRunner runner = registry.register("balances", new RecordingProjection());

    assertEquals("balances.v1", runner.name());
    assertEquals(ProjectionRegistry.qualifiedName("balances", 1), runner.deadLetters().projectionName());
    assertSame(runner, registry.runner("balances"));
    assertEquals(1, registry.activeVersion("balances"));
    assertTrue(registry.contains("balances"));
  }

  @Test
  void rejectsDuplicateAndUnknownNames() {
    ProjectionRegistry registry = newRegistry();
    registry.register("balances", new RecordingProjection());

    assertThrows(IllegalArgumentException.class, () -> registry.register("balances", new RecordingProjection()));
    assertThrows(IllegalArgumentException.class, () -> registry.runner("unknown"));
    assertThrows(IllegalArgumentException.class,
        () -> registry.registerVersion("balances", 1, new RecordingProjection()));
    assertThrows(IllegalArgumentException.class,
        () -> registry.registerVersion("balances", 0, new RecordingProjection()));
  }

  @Test
  void shadowVersionIsRebuiltAndCutOver() {
    ProjectionRegistry registry = newRegistry();
    RecordingProjection v1 = new RecordingProjection();
    registry.register("balances", v1);
    journal.append("s-1", 0, TestEvents.events(3));
    journal.append("s-2", 0, TestEvents.events(2));
    registry.runner("balances").consume(journal.read("s-1", 1));
    registry.runner("balances").consume(journal.read("s-2", 1));

    RecordingProjection v2 = new RecordingProjection();
    registry.registerVersion("balances", 2, v2);
    assertEquals(2, registry.runners().size());
    assertFalse(registry.isCaughtUp("balances", 2));
    assertThrows(IllegalStateException.class, () -> registry.cutover("balances", 2));
    assertEquals(1, registry.activeVersion("balances"));

    assertEquals(5, registry.replay("balances", 2, 0));
    assertTrue(registry.isCaughtUp("balances", 2));
    assertEquals(List.of(1L, 2L, 3L), v2.applied("s-1"));

    assertEquals(1, registry.cutover("balances", 2));
    assertEquals(2, registry.activeVersion("balances"));
    assertEquals("balances.v2", registry.runner("balances").name());
    assertEquals(1, registry.runners().size());
    assertThrows(IllegalArgumentException.class, () -> registry.runner("balances", 1));
    assertThrows(IllegalArgumentException.class,
        () -> registry.registerVersion("balances", 1, new RecordingProjection()));
  }

  @Test
  void cutoverRefusesVersionWithOpenDeadLetters() {
    ProjectionRegistry registry = newRegistry();
    registry.register("balances", new RecordingProjection());
    RecordingProjection v2 = new RecordingProjection();
    v2.poison("s-1", 2);
    registry.registerVersion("balances", 2, v2);
    journal.append("s-1", 0, TestEvents.events(2));

    registry.replay("balances", 2, 0);

    assertEquals(StreamState.QUARANTINED, registry.runner("balances", 2).state("s-1"));
    assertThrows(IllegalStateException.class, () -> registry.cutover("balances", 2));
  }

  @Test
  void versionsKeepSeparateCheckpointsAndDeadLetters() {
    ProjectionRegistry registry = newRegistry();
    RecordingProjection v1 = new RecordingProjection();
    v1.poison("s-1", 1);
    registry.register("balances", v1);
    registry.registerVersion("balances", 2, new RecordingProjection());
    journal.append("s-1", 0, TestEvents.events(1));

    for (ProjectionRunner runner : registry.runners()) {
      runner.consume(journal.read("s-1", 1));
    }

    assertEquals(0, registry.runner("balances", 1).checkpoint("s-1"));
    assertEquals(1, registry.runner("balances", 2).checkpoint("s-1"));
    List<DeadLetterSummary> open = registry.listDeadLetters();
    assertEquals(1, open.size());
    assertEquals("balances.v1", open.get(0).projectionName());
  }

  @Test
  void quarantineSurvivesRestart() {
    RecordingProjection projection = new RecordingProjection();
    projection.poison("s-1", 1);
    journal.append("s-1", 0, TestEvents.events(2));
    ProjectionRegistry before = newRegistry();
    before.register("balances", projection).consume(journal.read("s-1", 1));

    projection.healAll();
    ProjectionRegistry after = newRegistry();
    ProjectionRunner restarted = after.register("balances", projection);

    assertEquals(StreamState.QUARANTINED, restarted.state("s-1"));
    assertEquals(new RedriveResult.Success("s-1", 2, 2), after.redrive("balances", "s-1"));
    assertEquals(StreamState.FLOWING, restarted.state("s-1"));
  }

  @Test
  void resetRebuildsVersionFromScratch() {
    ProjectionRegistry registry = newRegistry();
    RecordingProjection projection = new RecordingProjection();
    registry.register("balances", projection);
    journal.append("s-1", 0, TestEvents.events(2));
    registry.runner("balances").consume(journal.read("s-1", 1));

    registry.reset("balances", 1);
    assertEquals(0, registry.runner("balances").checkpoint("s-1"));

    registry.replay("balances", 0);
    assertEquals(List.of(1L, 2L), projection.applied("s-1"));
    assertEquals(2, registry.runner("balances").checkpoint("s-1"));
  }
}
