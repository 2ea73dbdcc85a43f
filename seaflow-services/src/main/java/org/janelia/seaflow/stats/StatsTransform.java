package org.janelia.seaflow.stats;

import java.util.EnumMap;
import java.util.Map;

import org.janelia.seaflow.evt.EvtChannel;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.janelia.seaflow.filter.FilteredResult;

/**
 * Channel statistics and the log scale transform applied to continuous values before they are stored in the database.
 */
public class StatsTransform {

    /**
     * Raw readings are 16-bit values that span 3.5 decades of instrument dynamic range.
     */
    public static final double TRANSFORM_RANGE = 65536; // 2^16
    public static final double TRANSFORM_DECADES = 3.5;

    private StatsTransform() {
    }

    public static ChannelStats compute(FilteredResult result) {
        if (result.getRetainedCount() == 0) {
            return ChannelStats.empty();
        }
        ParticleMatrix opp = result.getParticles();
        Map<EvtChannel, ChannelSummary> summaries = new EnumMap<>(EvtChannel.class);
        for (EvtChannel channel : EvtChannel.CONTINUOUS) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            double sum = 0;
            for (int r = 0; r < opp.getRowCount(); r++) {
                double v = opp.get(r, channel);
                min = Math.min(min, v);
                max = Math.max(max, v);
                sum += v;
            }
            summaries.put(channel, new ChannelSummary(min, max, sum / opp.getRowCount()));
        }
        return new ChannelStats(summaries);
    }

    public static double transform(double value) {
        return Math.pow(10, (value / TRANSFORM_RANGE) * TRANSFORM_DECADES);
    }

    public static ChannelStats transform(ChannelStats stats) {
        return stats.map(v -> transform(v));
    }
}
