/**
 * Root API of the MISP IOC extractor: pulls recently modified attributes out of a MISP
 * database and persists them to a cumulative cache and a per-run JSON snapshot.
 *
 * <h2>Core Design</h2>
 * <p>{@link iocextract.IocExtractor#runOnce()} reads every attribute of an allowed type whose
 * timestamp falls inside the lookback window with a single joined query, normalizes the rows
 * into {@link iocextract.model.IocRecord}s and writes them to both sinks. The cache upserts on
 * {@code attribute_id}, so repeated runs never duplicate rows; the snapshot is replaced
 * wholesale so it always mirrors the latest run.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>ioc-extractor-core</b>: orchestrator, SPI, normalizer, JSON snapshot, scheduler</li>
 *   <li><b>ioc-extractor-jdbc</b>: MISP source reader and cache stores (H2, MySQL,
 *       PostgreSQL)</li>
 *   <li><b>ioc-extractor-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>ioc-extractor-spring-boot-starter</b>: property-driven auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * IocExtractor extractor = IocExtractor.builder()
 *     .sourceConnections(new DataSourceConnectionProvider(mispDataSource))
 *     .sourceReader(MispSourceReader.builder().queryTimeout(Duration.ofMinutes(5)).build())
 *     .cacheConnections(new DriverManagerConnectionProvider("jdbc:h2:file:./ioc_cache"))
 *     .cacheSink(new H2CacheStore())
 *     .snapshotSink(new JsonSnapshotSink(Path.of("misp_recent_iocs.json")))
 *     .lookback(Duration.ofHours(24))
 *     .attributeTypes(List.of("ip-dst", "domain", "md5"))
 *     .build();
 *
 * RunSummary summary = extractor.runOnce();
 * }</pre>
 *
 * @see iocextract.IocExtractor
 * @see iocextract.RunSummary
 * @see iocextract.schedule.ExtractionScheduler
 */
package iocextract;
