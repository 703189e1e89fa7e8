/**
 * Service provider interfaces for journal persistence, connection management and
 * metrics.
 *
 * <p>Store methods take an explicit {@link java.sql.Connection}; the calling component
 * decides the transaction boundaries.
 */
package eventjournal.spi;
