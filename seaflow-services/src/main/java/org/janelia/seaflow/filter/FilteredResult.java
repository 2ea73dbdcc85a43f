package org.janelia.seaflow.filter;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.seaflow.evt.ParticleMatrix;

/**
 * The focused particles (OPP) retained from an EVT matrix together with the counts and the effective parameters.
 */
public class FilteredResult {

    private final ParticleMatrix particles;
    private final int totalCount;
    private final FilterParams params;

    public FilteredResult(ParticleMatrix particles, int totalCount, FilterParams params) {
        this.particles = particles;
        this.totalCount = totalCount;
        this.params = params;
    }

    /**
     * @return retained rows in acquisition order
     */
    public ParticleMatrix getParticles() {
        return particles;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public int getRetainedCount() {
        return particles.getRowCount();
    }

    public double getRatio() {
        return totalCount == 0 ? 0.0 : (double) getRetainedCount() / totalCount;
    }

    public FilterParams getParams() {
        return params;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("totalCount", totalCount)
                .append("retainedCount", getRetainedCount())
                .append("params", params)
                .toString();
    }
}
