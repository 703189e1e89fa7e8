/**
 * Built-in dialects (H2, MySQL, PostgreSQL) and the {@link eventjournal.jdbc.dialect.Dialects} registry.
 */
package eventjournal.jdbc.dialect;
