package iocextract.jdbc.cache;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC cache stores with auto-detection from the cache JDBC URL.
 *
 * <p>Cache stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/iocextract.jdbc.cache.AbstractJdbcCacheStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from JDBC URL
 * AbstractJdbcCacheStore store = JdbcCacheStores.detect("jdbc:h2:file:./ioc_cache");
 *
 * // Auto-detect, writing to a custom table
 * AbstractJdbcCacheStore store = JdbcCacheStores.detect("jdbc:mysql://cache/iocs", "recent_iocs");
 *
 * // Get by name
 * AbstractJdbcCacheStore store = JdbcCacheStores.get("postgresql");
 * }</pre>
 */
public final class JdbcCacheStores {

    private static final List<AbstractJdbcCacheStore> STORES;
    private static final Map<String, AbstractJdbcCacheStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcCacheStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcCacheStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcCacheStores() {
    }

    /**
     * Returns all registered cache stores.
     */
    public static List<AbstractJdbcCacheStore> all() {
        return STORES;
    }

    /**
     * Gets a cache store by name.
     *
     * @param name cache store name (case-insensitive)
     * @return the cache store
     * @throws IllegalArgumentException if no cache store found
     */
    public static AbstractJdbcCacheStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcCacheStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown cache store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the cache store from a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return detected cache store writing to the default table
     * @throws IllegalArgumentException if no matching cache store found
     */
    public static AbstractJdbcCacheStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String url = jdbcUrl.toLowerCase();
        for (AbstractJdbcCacheStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No cache store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects the cache store from a JDBC URL, writing to {@code tableName}.
     */
    public static AbstractJdbcCacheStore detect(String jdbcUrl, String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        AbstractJdbcCacheStore template = detect(jdbcUrl);
        if (template.tableName().equals(tableName)) {
            return template;
        }
        return template.withTableName(tableName);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
