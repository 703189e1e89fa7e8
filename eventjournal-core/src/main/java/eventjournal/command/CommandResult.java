package eventjournal.command;

import eventjournal.EventEnvelope;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a command execution.
 *
 * @param streamId         the stream the command ran against
 * @param committedVersion the stream version after the append (unchanged if no events)
 * @param events           the committed events, empty when the command decided nothing
 * @param attempts         how many times the command was decided
 */
public record CommandResult(String streamId, long committedVersion, List<EventEnvelope> events, int attempts) {

  public CommandResult {
    Objects.requireNonNull(streamId, "streamId");
    events = List.copyOf(events);
  }

  public boolean committed() {
    return !events.isEmpty();
  }
}
