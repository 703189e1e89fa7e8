/**
 * Command execution with optimistic concurrency and bounded rehydrate-and-retry.
 */
package eventjournal.command;
