package org.janelia.seaflow.sink;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collections;

import javax.sql.DataSource;

import com.google.common.base.Joiner;
import org.janelia.seaflow.evt.EvtChannel;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.janelia.seaflow.filter.FilterParams;
import org.janelia.seaflow.filter.FilteredResult;
import org.janelia.seaflow.stats.ChannelStats;
import org.janelia.seaflow.stats.ChannelSummary;
import org.janelia.seaflow.stats.StatsTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores OPP particles and the per file filter summary in the <code>opp</code> and <code>filter</code> tables.
 * Continuous channel values and statistics are log transformed before they are stored.
 * Each file is written in its own transaction.
 */
public class JdbcOppSink implements ResultSink {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOppSink.class);

    static final String INSERT_OPP_SQL = insertStatement("opp", 3 + EvtChannel.COUNT);
    static final String INSERT_FILTER_SQL = insertStatement("filter", 10 + 3 * EvtChannel.CONTINUOUS.size());

    private final DataSource dataSource;
    private final String cruise;
    private final boolean saveParticles;

    public JdbcOppSink(DataSource dataSource, String cruise, boolean saveParticles) {
        this.dataSource = dataSource;
        this.cruise = cruise;
        this.saveParticles = saveParticles;
    }

    private static String insertStatement(String table, int nColumns) {
        return "INSERT INTO " + table + " VALUES (" + Joiner.on(',').join(Collections.nCopies(nColumns, '?')) + ")";
    }

    @Override
    public void write(String fileKey, FilteredResult result, ChannelStats stats) {
        if (result.getRetainedCount() == 0) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (saveParticles) {
                    insertParticles(conn, fileKey, result.getParticles());
                }
                insertFilterSummary(conn, fileKey, result, stats);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                try {
                    conn.rollback();
                } catch (SQLException rollbackException) {
                    e.addSuppressed(rollbackException);
                }
                throw e;
            }
        } catch (SQLException e) {
            LOG.error("Error saving OPP data for {} {}", cruise, fileKey, e);
            throw new PersistenceException("Error saving OPP data for " + cruise + " " + fileKey, e);
        }
        LOG.debug("Saved {} OPP particles for {} {}", result.getRetainedCount(), cruise, fileKey);
    }

    private void insertParticles(Connection conn, String fileKey, ParticleMatrix opp) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(INSERT_OPP_SQL)) {
            for (int r = 0; r < opp.getRowCount(); r++) {
                int fieldIndex = 1;
                pstmt.setString(fieldIndex++, cruise);
                pstmt.setString(fieldIndex++, fileKey);
                pstmt.setLong(fieldIndex++, r + 1);
                for (EvtChannel channel : EvtChannel.values()) {
                    double value = opp.get(r, channel);
                    if (channel.isIntegral()) {
                        pstmt.setLong(fieldIndex++, (long) value);
                    } else {
                        pstmt.setDouble(fieldIndex++, StatsTransform.transform(value));
                    }
                }
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        }
    }

    private void insertFilterSummary(Connection conn, String fileKey, FilteredResult result, ChannelStats stats) throws SQLException {
        FilterParams params = result.getParams();
        ChannelStats transformedStats = StatsTransform.transform(stats);
        try (PreparedStatement pstmt = conn.prepareStatement(INSERT_FILTER_SQL)) {
            int fieldIndex = 1;
            pstmt.setString(fieldIndex++, cruise);
            pstmt.setString(fieldIndex++, fileKey);
            pstmt.setLong(fieldIndex++, result.getRetainedCount());
            pstmt.setLong(fieldIndex++, result.getTotalCount());
            pstmt.setDouble(fieldIndex++, result.getRatio());
            pstmt.setDouble(fieldIndex++, params.getNotch1());
            pstmt.setDouble(fieldIndex++, params.getNotch2());
            pstmt.setDouble(fieldIndex++, params.getOffset());
            pstmt.setDouble(fieldIndex++, params.getOrigin());
            pstmt.setDouble(fieldIndex++, params.getWidth());
            for (EvtChannel channel : EvtChannel.CONTINUOUS) {
                ChannelSummary summary = transformedStats.get(channel)
                        .orElseThrow(() -> new IllegalStateException("No " + channel.getColumnName() + " statistics for " + fileKey));
                pstmt.setDouble(fieldIndex++, summary.getMin());
                pstmt.setDouble(fieldIndex++, summary.getMax());
                pstmt.setDouble(fieldIndex++, summary.getMean());
            }
            pstmt.executeUpdate();
        }
    }
}
