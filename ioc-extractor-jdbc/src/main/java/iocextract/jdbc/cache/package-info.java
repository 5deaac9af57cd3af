/**
 * JDBC cache stores: one upserted row per MISP attribute id, with lookup indexes on type,
 * value and event id.
 *
 * <p>Built-in stores cover H2 (the single-file default), MySQL and PostgreSQL. Stores are
 * discovered through {@link java.util.ServiceLoader}; see {@link iocextract.jdbc.cache.JdbcCacheStores}.
 */
package iocextract.jdbc.cache;
