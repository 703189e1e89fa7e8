/**
 * Aggregate rehydration: explicit event handler tables, snapshots and the snapshot
 * policy.
 */
package eventjournal.aggregate;
