/**
 * Extension point for additional databases.
 */
package eventjournal.jdbc.spi;
