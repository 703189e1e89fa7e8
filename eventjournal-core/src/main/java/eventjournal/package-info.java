/**
 * Append-only aggregate event journal with optimistic concurrency, snapshot-based
 * rehydration and projections guarded by a sequence-aware dead-letter queue.
 *
 * <p>{@link eventjournal.Journal} wires the components together; they can also be
 * built individually from the subpackages.
 */
package eventjournal;
