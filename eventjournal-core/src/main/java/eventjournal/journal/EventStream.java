package eventjournal.journal;

import eventjournal.EventEnvelope;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, restartable, finite sequence of the events of one stream.
 *
 * <p>Events are fetched page by page as the iterator advances. Every call to
 * {@link #iterator()} starts again at the first version of the range, and no iterator
 * goes past the upper bound fixed when the stream was created.
 */
public final class EventStream implements Iterable<EventEnvelope> {
  private final EventJournal journal;
  private final String streamId;
  private final long fromVersion;
  private final long toVersion;
  private final int pageSize;

  EventStream(EventJournal journal, String streamId, long fromVersion, long toVersion, int pageSize) {
    this.journal = journal;
    this.streamId = streamId;
    this.fromVersion = fromVersion;
    this.toVersion = toVersion;
    this.pageSize = pageSize;
  }

  public String streamId() {
    return streamId;
  }

  public long fromVersion() {
    return fromVersion;
  }

  /**
   * Returns the inclusive upper version bound of this stream.
   */
  public long toVersion() {
    return toVersion;
  }

  public boolean isEmpty() {
    return !iterator().hasNext();
  }

  /**
   * Reads every event of the range into memory.
   */
  public List<EventEnvelope> toList() {
    List<EventEnvelope> events = new ArrayList<>();
    for (EventEnvelope event : this) {
      events.add(event);
    }
    return events;
  }

  @Override
  public Iterator<EventEnvelope> iterator() {
    return new PagingIterator();
  }

  private final class PagingIterator implements Iterator<EventEnvelope> {
    private long nextVersion = fromVersion;
    private Iterator<EventEnvelope> page = List.<EventEnvelope>of().iterator();
    private boolean exhausted = fromVersion > toVersion;

    @Override
    public boolean hasNext() {
      if (page.hasNext()) {
        return true;
      }
      if (exhausted) {
        return false;
      }
      long pageStart = nextVersion;
      long pageEnd = Math.min(toVersion, pageStart + pageSize - 1);
      List<EventEnvelope> events = journal.readPage(streamId, pageStart, pageEnd, pageSize);
      if (events.isEmpty()) {
        exhausted = true;
        return false;
      }
      nextVersion = events.get(events.size() - 1).version() + 1;
      // a short page means the stream ends before the bound
      exhausted = nextVersion > toVersion || events.size() < pageEnd - pageStart + 1;
      page = events.iterator();
      return true;
    }

    @Override
    public EventEnvelope next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return page.next();
    }
  }
}
