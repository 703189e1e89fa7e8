/**
 * Sequence-aware dead-letter queue: per-stream quarantine that preserves event order,
 * and ordered, cancellable redrive.
 */
package eventjournal.dlq;
