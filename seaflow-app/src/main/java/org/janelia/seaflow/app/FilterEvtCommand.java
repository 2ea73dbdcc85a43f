package org.janelia.seaflow.app;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.commons.lang3.StringUtils;
import org.janelia.seaflow.batch.BatchOrchestrator;
import org.janelia.seaflow.batch.BatchSummary;
import org.janelia.seaflow.batch.EvtFileProcessor;
import org.janelia.seaflow.batch.LoggingProgressListener;
import org.janelia.seaflow.config.ApplicationConfig;
import org.janelia.seaflow.config.FilterRunConfig;
import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.fetch.HttpRemoteFetcher;
import org.janelia.seaflow.fetch.RemoteFetcher;
import org.janelia.seaflow.fetch.RemoteObjectStore;
import org.janelia.seaflow.fetch.RetryingRemoteFetcher;
import org.janelia.seaflow.fetch.Sleeper;
import org.janelia.seaflow.filter.FilterEngine;
import org.janelia.seaflow.filter.FilterParams;
import org.janelia.seaflow.sink.BinaryOppSink;
import org.janelia.seaflow.sink.JdbcOppSink;
import org.janelia.seaflow.sink.ResultSink;
import org.janelia.seaflow.sink.SchemaManager;
import org.janelia.seaflow.sink.SqliteDataSourceFactory;
import org.janelia.seaflow.utils.ArchiveUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the filter pipeline from the command line arguments and the application properties and runs it.
 */
class FilterEvtCommand {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEvtCommand.class);

    static final String FILTER_WIDTH_PROPERTY = "seaflow.filter.width";
    static final String FILTER_OFFSET_PROPERTY = "seaflow.filter.offset";
    static final String WORKERS_PROPERTY = "seaflow.batch.workers";
    static final String PROGRESS_PROPERTY = "seaflow.batch.progressPercent";
    static final String FETCH_BASE_URL_PROPERTY = "seaflow.fetch.baseURL";
    static final String FETCH_MAX_ATTEMPTS_PROPERTY = "seaflow.fetch.maxAttempts";
    static final String FETCH_CONNECT_TIMEOUT_PROPERTY = "seaflow.fetch.connectTimeoutMillis";
    static final String FETCH_SOCKET_TIMEOUT_PROPERTY = "seaflow.fetch.socketTimeoutMillis";
    static final String DB_BUSY_TIMEOUT_PROPERTY = "seaflow.db.busyTimeoutMillis";
    static final String DB_MAX_POOL_SIZE_PROPERTY = "seaflow.db.maxPoolSize";

    static final int DEFAULT_DB_MAX_POOL_SIZE = 4;

    private final ApplicationConfig applicationConfig;
    private final EvtFileLister evtFileLister;
    private final ObjectMapper objectMapper = new ObjectMapper();

    FilterEvtCommand(ApplicationConfig applicationConfig, EvtFileLister evtFileLister) {
        this.applicationConfig = applicationConfig;
        this.evtFileLister = evtFileLister;
    }

    BatchSummary run(FilterEvtArgs args) throws IOException {
        FilterRunConfig runConfig = createRunConfig(args);
        LOG.info("Defined parameters:\n{}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(runConfig));
        RemoteObjectStore remoteStore = runConfig.isRemote() ? openRemoteStore(runConfig.getWorkers()) : null;
        try {
            List<String> references = EvtFileLister.limit(listInputs(args, runConfig, remoteStore), runConfig.getLimit());
            return run(runConfig, references, remoteStore);
        } finally {
            if (remoteStore != null) {
                remoteStore.close();
            }
        }
    }

    FilterRunConfig createRunConfig(FilterEvtArgs args) {
        FilterParams filterParams = FilterParams.builder()
                .notch1(args.notch1)
                .notch2(args.notch2)
                .origin(args.origin)
                .width(args.width != null
                        ? args.width
                        : applicationConfig.getDoublePropertyValue(FILTER_WIDTH_PROPERTY, FilterParams.DEFAULT_WIDTH))
                .offset(args.offset != null
                        ? args.offset
                        : applicationConfig.getDoublePropertyValue(FILTER_OFFSET_PROPERTY, FilterParams.DEFAULT_OFFSET))
                .build();
        return FilterRunConfig.builder()
                .cruise(args.cruise)
                .filterParams(filterParams)
                .workers(args.workers != null
                        ? args.workers
                        : applicationConfig.getIntegerPropertyValue(WORKERS_PROPERTY, FilterRunConfig.DEFAULT_WORKERS))
                .progressPercent(args.progress != null
                        ? args.progress
                        : applicationConfig.getDoublePropertyValue(PROGRESS_PROPERTY, FilterRunConfig.DEFAULT_PROGRESS_PERCENT))
                .limit(args.limit)
                .remote(args.remote)
                .db(args.db)
                .binaryDir(args.binaryDir)
                .saveParticles(!args.noOppDb)
                .createIndexes(!args.noIndex)
                .gzipDb(args.gzDb)
                .gzipBinary(args.gzBinary)
                .build();
    }

    private List<String> listInputs(FilterEvtArgs args, FilterRunConfig runConfig, RemoteObjectStore remoteStore) throws IOException {
        if (StringUtils.isNotBlank(args.evtDir)) {
            Preconditions.checkArgument(args.files.isEmpty() && !runConfig.isRemote(),
                    "-evtDir cannot be combined with EVT file references or -remote");
            return evtFileLister.listDirectory(Paths.get(args.evtDir));
        }
        if (args.files.isEmpty() && remoteStore != null) {
            return evtFileLister.listRemote(remoteStore, runConfig.getCruise());
        }
        Preconditions.checkArgument(!args.files.isEmpty(), "EVT file references, -evtDir or -remote are required");
        return evtFileLister.listFiles(args.files);
    }

    /**
     * @param remoteStore source of the referenced EVT files, null when they are local
     */
    BatchSummary run(FilterRunConfig runConfig, List<String> references, RemoteObjectStore remoteStore) throws IOException {
        HikariDataSource dataSource = null;
        BatchSummary summary;
        try {
            List<ResultSink> sinks = new ArrayList<>();
            SchemaManager schemaManager = null;
            if (runConfig.getDbFile().isPresent()) {
                dataSource = createDataSource(runConfig.getDbFile().get(), runConfig.getWorkers());
                schemaManager = new SchemaManager(dataSource);
                schemaManager.ensureTables();
                sinks.add(new JdbcOppSink(dataSource, runConfig.getCruise(), runConfig.isSaveParticles()));
            }
            EvtCodec codec = new EvtCodec();
            if (runConfig.getBinaryDir().isPresent()) {
                sinks.add(new BinaryOppSink(runConfig.getBinaryDir().get(), runConfig.isGzipBinary(), codec));
            }
            RemoteFetcher remoteFetcher = null;
            if (remoteStore != null) {
                remoteFetcher = new RetryingRemoteFetcher(remoteStore,
                        applicationConfig.getIntegerPropertyValue(FETCH_MAX_ATTEMPTS_PROPERTY, RetryingRemoteFetcher.DEFAULT_MAX_ATTEMPTS),
                        Sleeper.THREAD_SLEEPER,
                        () -> ThreadLocalRandom.current().nextDouble());
            }
            EvtFileProcessor processor = new EvtFileProcessor(remoteFetcher, codec, new FilterEngine(), runConfig.getFilterParams(), sinks);
            BatchOrchestrator orchestrator = new BatchOrchestrator(processor,
                    runConfig.getWorkers(),
                    runConfig.getProgressPercent(),
                    new LoggingProgressListener());
            summary = orchestrator.run(references);
            if (schemaManager != null && runConfig.isCreateIndexes()) {
                schemaManager.ensureIndexes();
            }
        } finally {
            if (dataSource != null) {
                dataSource.close();
            }
        }
        if (runConfig.isGzipDb() && runConfig.getDbFile().isPresent()) {
            ArchiveUtils.gzipFile(runConfig.getDbFile().get());
        }
        return summary;
    }

    /**
     * The pool has at least one connection per worker so that writers only wait on the database lock.
     */
    HikariDataSource createDataSource(Path dbFile, int workers) throws IOException {
        Path dbDir = dbFile.toAbsolutePath().getParent();
        if (dbDir != null) {
            Files.createDirectories(dbDir);
        }
        int maxPoolSize = applicationConfig.getIntegerPropertyValue(DB_MAX_POOL_SIZE_PROPERTY, DEFAULT_DB_MAX_POOL_SIZE);
        return SqliteDataSourceFactory.createPooledDatasource(dbFile,
                Math.max(maxPoolSize, workers),
                applicationConfig.getLongPropertyValue(DB_BUSY_TIMEOUT_PROPERTY, 120000L));
    }

    RemoteObjectStore openRemoteStore(int maxConnections) {
        String baseURL = applicationConfig.getStringPropertyValue(FETCH_BASE_URL_PROPERTY);
        Preconditions.checkArgument(StringUtils.isNotBlank(baseURL), "%s must be set to read remote EVT files", FETCH_BASE_URL_PROPERTY);
        return new HttpRemoteFetcher(baseURL,
                maxConnections,
                applicationConfig.getIntegerPropertyValue(FETCH_CONNECT_TIMEOUT_PROPERTY, 30000),
                applicationConfig.getIntegerPropertyValue(FETCH_SOCKET_TIMEOUT_PROPERTY, 120000));
    }
}
