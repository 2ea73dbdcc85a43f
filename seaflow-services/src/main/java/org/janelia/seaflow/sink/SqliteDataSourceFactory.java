package org.janelia.seaflow.sink;

import java.nio.file.Path;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Pooled data source for an SQLite database file. Concurrent writers wait on the database lock for up to
 * <code>busyTimeoutMillis</code> and a writer waiting for a pooled connection waits at least as long.
 */
public class SqliteDataSourceFactory {

    // smallest connection timeout accepted by Hikari
    static final long MIN_CONNECTION_TIMEOUT_MILLIS = 250L;

    private SqliteDataSourceFactory() {
    }

    public static HikariDataSource createPooledDatasource(Path dbFile, int maxPoolSize, long busyTimeoutMillis) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
        config.setMaximumPoolSize(maxPoolSize);
        config.setConnectionTimeout(Math.max(busyTimeoutMillis, MIN_CONNECTION_TIMEOUT_MILLIS));
        config.setPoolName("seaflow-db");
        config.addDataSourceProperty("busy_timeout", String.valueOf(busyTimeoutMillis));
        return new HikariDataSource(config);
    }
}
