/**
 * Small concurrency helpers shared by the journal components.
 */
package eventjournal.util;
