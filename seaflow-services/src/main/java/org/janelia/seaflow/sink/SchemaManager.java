package org.janelia.seaflow.sink;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import javax.sql.DataSource;

import com.google.common.collect.ImmutableList;
import org.janelia.seaflow.evt.EvtChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the OPP and filter tables and their indexes.
 */
public class SchemaManager {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaManager.class);

    static final String CREATE_OPP_TABLE = "CREATE TABLE IF NOT EXISTS opp (" +
            "cruise TEXT NOT NULL, " +
            "file TEXT NOT NULL, " +
            "particle INTEGER NOT NULL, " +
            "time INTEGER NOT NULL, " +
            "pulse_width INTEGER NOT NULL, " +
            "D1 REAL NOT NULL, " +
            "D2 REAL NOT NULL, " +
            "fsc_small REAL NOT NULL, " +
            "fsc_perp REAL NOT NULL, " +
            "fsc_big REAL NOT NULL, " +
            "pe REAL NOT NULL, " +
            "chl_small REAL NOT NULL, " +
            "chl_big REAL NOT NULL, " +
            "PRIMARY KEY (cruise, file, particle))";

    static final String CREATE_FILTER_TABLE = createFilterTableStatement();

    static final List<String> CREATE_INDEXES = ImmutableList.of(
            "CREATE INDEX IF NOT EXISTS oppFileIndex ON opp (file)",
            "CREATE INDEX IF NOT EXISTS oppFsc_smallIndex ON opp (fsc_small)",
            "CREATE INDEX IF NOT EXISTS oppPeIndex ON opp (pe)",
            "CREATE INDEX IF NOT EXISTS oppChl_smallIndex ON opp (chl_small)"
    );

    private final DataSource dataSource;

    public SchemaManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    private static String createFilterTableStatement() {
        StringBuilder ddlBuilder = new StringBuilder("CREATE TABLE IF NOT EXISTS filter (")
                .append("cruise TEXT NOT NULL, ")
                .append("file TEXT NOT NULL, ")
                .append("opp_count INTEGER NOT NULL, ")
                .append("evt_count INTEGER NOT NULL, ")
                .append("opp_evt_ratio REAL NOT NULL, ")
                .append("notch1 REAL NOT NULL, ")
                .append("notch2 REAL NOT NULL, ")
                .append("offset REAL NOT NULL, ")
                .append("origin REAL NOT NULL, ")
                .append("width REAL NOT NULL, ");
        for (EvtChannel channel : EvtChannel.CONTINUOUS) {
            for (String stat : ImmutableList.of("min", "max", "mean")) {
                ddlBuilder.append(channel.getColumnName()).append('_').append(stat).append(" REAL NOT NULL, ");
            }
        }
        return ddlBuilder.append("PRIMARY KEY (cruise, file))").toString();
    }

    public void ensureTables() {
        execute(ImmutableList.of(CREATE_OPP_TABLE, CREATE_FILTER_TABLE));
    }

    public void ensureIndexes() {
        long startTime = System.currentTimeMillis();
        LOG.info("Creating DB indexes");
        execute(CREATE_INDEXES);
        LOG.info("Index creation completed in {}secs", (System.currentTimeMillis() - startTime) / 1000.);
    }

    private void execute(List<String> statements) {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                LOG.debug("Execute {}", sql);
                stmt.executeUpdate(sql);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Error updating the database schema", e);
        }
    }
}
