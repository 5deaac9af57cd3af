package iocextract.spring.boot;

import com.zaxxer.hikari.HikariDataSource;
import iocextract.IocExtractor;
import iocextract.jdbc.DataSourceConnectionProvider;
import iocextract.jdbc.DriverManagerConnectionProvider;
import iocextract.jdbc.cache.AbstractJdbcCacheStore;
import iocextract.jdbc.cache.JdbcCacheStores;
import iocextract.jdbc.source.MispSourceReader;
import iocextract.schedule.ExtractionScheduler;
import iocextract.snapshot.JsonSnapshotSink;
import iocextract.spi.ConnectionProvider;
import iocextract.spi.MetricsExporter;
import iocextract.spi.SnapshotSink;
import iocextract.spi.SourceReader;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Auto-configuration for the MISP IOC extractor.
 *
 * <p>Wires an {@link IocExtractor} from {@link IocExtractorProperties}: a pooled MISP source,
 * a cache store detected from {@code ioc-extractor.output.cache-url} and a JSON snapshot file.
 * The MISP pool connects lazily, so the context starts while MISP is down.
 * An {@link ExtractionScheduler} is added when {@code ioc-extractor.schedule.enabled=true}.
 *
 * @see IocExtractorProperties
 * @see IocExtractorMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(IocExtractor.class)
@EnableConfigurationProperties(IocExtractorProperties.class)
public class IocExtractorAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(name = "mispDataSource")
  public HikariDataSource mispDataSource(IocExtractorProperties props) {
    IocExtractorProperties.Source source = props.getSource();
    HikariDataSource ds = new HikariDataSource();
    ds.setPoolName("misp-source");
    ds.setJdbcUrl(source.resolveJdbcUrl());
    ds.setUsername(source.getUsername());
    ds.setPassword(source.getPassword());
    ds.setMaximumPoolSize(source.getMaximumPoolSize());
    ds.setMinimumIdle(0);
    return ds;
  }

  @Bean
  @ConditionalOnMissingBean(name = "sourceConnectionProvider")
  public ConnectionProvider sourceConnectionProvider(@Qualifier("mispDataSource") HikariDataSource mispDataSource) {
    return new DataSourceConnectionProvider(mispDataSource);
  }

  @Bean
  @ConditionalOnMissingBean(name = "cacheConnectionProvider")
  public ConnectionProvider cacheConnectionProvider(IocExtractorProperties props) {
    IocExtractorProperties.Output output = props.getOutput();
    return new DriverManagerConnectionProvider(
        output.getCacheUrl(), output.getCacheUsername(), output.getCachePassword());
  }

  @Bean
  @ConditionalOnMissingBean(SourceReader.class)
  public MispSourceReader mispSourceReader(IocExtractorProperties props) {
    IocExtractorProperties.Source source = props.getSource();
    return MispSourceReader.builder()
        .eventsTable(source.getEventsTable())
        .attributesTable(source.getAttributesTable())
        .queryTimeout(source.getQueryTimeout())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcCacheStore cacheStore(IocExtractorProperties props) {
    return JdbcCacheStores.detect(props.getOutput().getCacheUrl(), props.getOutput().getCacheTable());
  }

  @Bean
  @ConditionalOnMissingBean(SnapshotSink.class)
  public JsonSnapshotSink snapshotSink(IocExtractorProperties props) {
    return new JsonSnapshotSink(Path.of(props.getOutput().getSnapshotFile()));
  }

  @Bean
  @ConditionalOnMissingBean
  public IocExtractor iocExtractor(IocExtractorProperties props,
      @Qualifier("sourceConnectionProvider") ConnectionProvider sourceConnectionProvider,
      @Qualifier("cacheConnectionProvider") ConnectionProvider cacheConnectionProvider,
      SourceReader sourceReader,
      AbstractJdbcCacheStore cacheStore,
      SnapshotSink snapshotSink,
      ObjectProvider<MetricsExporter> metricsProvider) {

    IocExtractor.Builder builder = IocExtractor.builder()
        .sourceConnections(sourceConnectionProvider)
        .sourceReader(sourceReader)
        .cacheConnections(cacheConnectionProvider)
        .cacheSink(cacheStore)
        .snapshotSink(snapshotSink)
        .lookback(props.getExtraction().getLookback())
        .attributeTypes(props.getExtraction().getAttributeTypes());
    String backupFile = props.getOutput().getBackupFile();
    if (backupFile != null && !backupFile.isBlank()) {
      builder.cacheBackup(Path.of(backupFile));
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "ioc-extractor.schedule", name = "enabled", havingValue = "true")
  public ExtractionScheduler extractionScheduler(IocExtractor iocExtractor, IocExtractorProperties props) {
    return ExtractionScheduler.builder()
        .extractor(iocExtractor)
        .interval(props.getSchedule().getInterval())
        .initialDelay(props.getSchedule().getInitialDelay())
        .build();
  }
}
