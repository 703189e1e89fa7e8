/**
 * Read-model projections: ordered, idempotent application with per-stream checkpoints,
 * journal tailing, replay and blue-green version cutover.
 *
 * <p>Failures are handed to the {@link eventjournal.dlq.SequenceDeadLetterQueue} of the
 * projection, which quarantines the failing stream.
 */
package eventjournal.projection;
