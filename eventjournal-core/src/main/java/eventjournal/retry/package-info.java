/**
 * Backoff policies for retried storage operations and scheduled redrives.
 */
package eventjournal.retry;
