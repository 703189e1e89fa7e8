/**
 * Value types shared by the journal components and the storage SPI: snapshots,
 * projection checkpoints and dead-letter entries.
 */
package eventjournal.model;
