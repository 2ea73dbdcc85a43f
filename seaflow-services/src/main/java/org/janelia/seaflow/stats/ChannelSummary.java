package org.janelia.seaflow.stats;

import java.util.Objects;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Min, max and mean of one channel.
 */
public class ChannelSummary {

    private final double min;
    private final double max;
    private final double mean;

    public ChannelSummary(double min, double max, double mean) {
        this.min = min;
        this.max = max;
        this.mean = mean;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelSummary that = (ChannelSummary) o;
        return Double.compare(that.min, min) == 0 &&
                Double.compare(that.max, max) == 0 &&
                Double.compare(that.mean, mean) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, mean);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("min", min)
                .append("max", max)
                .append("mean", mean)
                .toString();
    }
}
