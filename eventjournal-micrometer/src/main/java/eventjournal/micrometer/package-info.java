/**
 * Micrometer bridge for journal metrics.
 */
package eventjournal.micrometer;
