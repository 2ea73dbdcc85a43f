package org.janelia.seaflow.stats;

import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableMap;
import org.janelia.seaflow.evt.EvtChannel;

/**
 * Per continuous channel summaries of the retained particles. Empty when nothing was retained.
 */
public class ChannelStats {

    private static final ChannelStats EMPTY = new ChannelStats(ImmutableMap.of());

    private final Map<EvtChannel, ChannelSummary> summaries;

    ChannelStats(Map<EvtChannel, ChannelSummary> summaries) {
        this.summaries = ImmutableMap.copyOf(summaries);
    }

    public static ChannelStats empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return summaries.isEmpty();
    }

    public Optional<ChannelSummary> get(EvtChannel channel) {
        return Optional.ofNullable(summaries.get(channel));
    }

    public Map<EvtChannel, ChannelSummary> asMap() {
        return summaries;
    }

    /**
     * Apply <code>valueTransform</code> to every min, max and mean.
     */
    public ChannelStats map(UnaryOperator<Double> valueTransform) {
        ImmutableMap.Builder<EvtChannel, ChannelSummary> builder = ImmutableMap.builder();
        summaries.forEach((channel, s) -> builder.put(channel, new ChannelSummary(
                valueTransform.apply(s.getMin()),
                valueTransform.apply(s.getMax()),
                valueTransform.apply(s.getMean()))));
        return new ChannelStats(builder.build());
    }

    @Override
    public String toString() {
        return summaries.toString();
    }
}
