package eventjournal.dlq;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory set of quarantined stream ids of one projection.
 *
 * <p>Read on every consumed event, written only on quarantine and redrive
 * transitions. Lookups are O(1) and lock-free.
 */
public final class QuarantineRegistry {
  private final Set<String> streams = ConcurrentHashMap.newKeySet();

  public boolean isQuarantined(String streamId) {
    return streams.contains(streamId);
  }

  /**
   * @return {@code true} if the stream was not quarantined before
   */
  public boolean quarantine(String streamId) {
    return streams.add(Objects.requireNonNull(streamId, "streamId"));
  }

  /**
   * @return {@code true} if the stream was quarantined
   */
  public boolean release(String streamId) {
    return streams.remove(streamId);
  }

  /**
   * Replaces the contents with the given stream ids, as loaded from storage.
   */
  public void replaceAll(Collection<String> streamIds) {
    streams.retainAll(Set.copyOf(streamIds));
    streams.addAll(streamIds);
  }

  public void clear() {
    streams.clear();
  }

  public int size() {
    return streams.size();
  }

  /**
   * Returns a point-in-time copy of the quarantined stream ids.
   */
  public Set<String> streams() {
    return Set.copyOf(streams);
  }
}
