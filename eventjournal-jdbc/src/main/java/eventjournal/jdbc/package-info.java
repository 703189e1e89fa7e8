/**
 * JDBC implementations of the journal persistence SPI.
 *
 * <p>{@link eventjournal.jdbc.JdbcStores} bundles the four stores and creates the schema
 * from {@code /schema/<dialect>.sql}. Database differences live in
 * {@link eventjournal.jdbc.spi.Dialect} implementations.
 */
package eventjournal.jdbc;
