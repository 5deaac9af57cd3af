/**
 * JDBC plumbing shared by the MISP source reader and the cache stores.
 *
 * @see iocextract.jdbc.source.MispSourceReader
 * @see iocextract.jdbc.cache.AbstractJdbcCacheStore
 * @see iocextract.jdbc.cache.JdbcCacheStores
 */
package iocextract.jdbc;
