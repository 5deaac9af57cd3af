package iocextract.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the MISP IOC extractor.
 *
 * @see IocExtractorAutoConfiguration
 */
@ConfigurationProperties(prefix = "ioc-extractor")
public class IocExtractorProperties {

    static final List<String> DEFAULT_ATTRIBUTE_TYPES = List.of(
            "ip-src", "ip-dst", "domain", "hostname", "url", "md5", "sha1", "sha256",
            "filename", "email-src", "email-dst", "mutex", "regkey", "snort", "yara");

    private final Source source = new Source();
    private final Extraction extraction = new Extraction();
    private final Output output = new Output();
    private final Schedule schedule = new Schedule();
    private final Metrics metrics = new Metrics();

    public Source getSource() {
        return source;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Output getOutput() {
        return output;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * MISP database connection.
     */
    public static class Source {
        private String host = "localhost";
        private int port = 3306;
        private String database = "misp";
        private String username = "misp";
        private String password = "";

        /**
         * Full JDBC URL; overrides host, port and database when set.
         */
        private String jdbcUrl;

        private String eventsTable = "events";
        private String attributesTable = "attributes";
        private Duration queryTimeout = Duration.ofMinutes(5);
        private int maximumPoolSize = 2;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getDatabase() {
            return database;
        }

        public void setDatabase(String database) {
            this.database = database;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getEventsTable() {
            return eventsTable;
        }

        public void setEventsTable(String eventsTable) {
            this.eventsTable = eventsTable;
        }

        public String getAttributesTable() {
            return attributesTable;
        }

        public void setAttributesTable(String attributesTable) {
            this.attributesTable = attributesTable;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        /**
         * The explicit JDBC URL, or a MySQL URL built from host, port and database.
         */
        public String resolveJdbcUrl() {
            if (jdbcUrl != null && !jdbcUrl.isBlank()) {
                return jdbcUrl;
            }
            return "jdbc:mysql://" + host + ":" + port + "/" + database;
        }
    }

    public static class Extraction {
        private Duration lookback = Duration.ofHours(24);
        private List<String> attributeTypes = new ArrayList<>(DEFAULT_ATTRIBUTE_TYPES);

        public Duration getLookback() {
            return lookback;
        }

        public void setLookback(Duration lookback) {
            this.lookback = lookback;
        }

        public List<String> getAttributeTypes() {
            return attributeTypes;
        }

        public void setAttributeTypes(List<String> attributeTypes) {
            this.attributeTypes = attributeTypes;
        }
    }

    public static class Output {
        private String snapshotFile = "misp_recent_iocs.json";
        private String cacheUrl = "jdbc:h2:file:./ioc_cache";
        private String cacheUsername;
        private String cachePassword;
        private String cacheTable = "misp_iocs";
        private String backupFile;

        public String getSnapshotFile() {
            return snapshotFile;
        }

        public void setSnapshotFile(String snapshotFile) {
            this.snapshotFile = snapshotFile;
        }

        public String getCacheUrl() {
            return cacheUrl;
        }

        public void setCacheUrl(String cacheUrl) {
            this.cacheUrl = cacheUrl;
        }

        public String getCacheUsername() {
            return cacheUsername;
        }

        public void setCacheUsername(String cacheUsername) {
            this.cacheUsername = cacheUsername;
        }

        public String getCachePassword() {
            return cachePassword;
        }

        public void setCachePassword(String cachePassword) {
            this.cachePassword = cachePassword;
        }

        public String getCacheTable() {
            return cacheTable;
        }

        public void setCacheTable(String cacheTable) {
            this.cacheTable = cacheTable;
        }

        /**
         * File the cache is backed up to before each run's writes, e.g.
         * {@code ioc_cache_yesterday.zip}. Unset disables backups. Only H2 file caches
         * support it.
         */
        public String getBackupFile() {
            return backupFile;
        }

        public void setBackupFile(String backupFile) {
            this.backupFile = backupFile;
        }
    }

    public static class Schedule {
        private boolean enabled = false;
        private Duration interval = Duration.ofHours(24);
        private Duration initialDelay = Duration.ZERO;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "ioc.extractor";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
