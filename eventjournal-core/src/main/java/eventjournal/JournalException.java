package eventjournal;

/**
 * Base type for unchecked failures raised by the event journal.
 */
public class JournalException extends RuntimeException {

  public JournalException(String message) {
    super(message);
  }

  public JournalException(String message, Throwable cause) {
    super(message, cause);
  }
}
