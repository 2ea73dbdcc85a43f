package org.janelia.seaflow.filter;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.janelia.seaflow.evt.EvtChannel;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separates optically focused particles (OPP) from the rest of the EVT particles.
 * <p>
 * Particles must be seen by the forward scatter sensor, be aligned between the D1 and D2 detectors within
 * <code>width</code>, and have a forward scatter above the notch lines through D1 and D2 shifted by
 * <code>offset</code>.
 */
public class FilterEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);

    /**
     * Scales width and offset to raw instrument units.
     */
    static final double UNIT_SCALE = 1e4;
    static final double NOTCH_DENOMINATOR_OFFSET = 10000;
    static final double FSC_SMALL_FLOOR = 1;

    public FilteredResult filter(ParticleMatrix evt, FilterParams params) {
        params.requireFixedParams();
        int totalCount = evt.getRowCount();
        if (totalCount == 0) {
            return new FilteredResult(ParticleMatrix.empty(), 0, params);
        }
        double width = params.getWidth();
        double offset = params.getOffset();

        double[] d1 = evt.getColumn(EvtChannel.D1);
        double[] d2 = evt.getColumn(EvtChannel.D2);
        double[] fscSmall = evt.getColumn(EvtChannel.FSC_SMALL);

        int[] candidates = IntStream.range(0, totalCount)
                .filter(i -> fscSmall[i] > FSC_SMALL_FLOOR)
                .toArray();

        // D1 and D2 detectors differ by a constant sensitivity offset
        double origin = params.getOrigin() != null
                ? params.getOrigin()
                : median(Arrays.stream(candidates).mapToDouble(i -> d2[i] - d1[i]).toArray());

        double band = width * UNIT_SCALE;
        int[] aligned = Arrays.stream(candidates)
                .filter(i -> d1[i] + origin < d2[i] + band && d2[i] < d1[i] + origin + band)
                .toArray();

        double fscSmallMax = Arrays.stream(aligned).mapToDouble(i -> fscSmall[i]).max().orElse(Double.NaN);

        double notch1 = params.getNotch1() != null ? params.getNotch1() : notch(aligned, d1, fscSmall, fscSmallMax);
        double notch2 = params.getNotch2() != null ? params.getNotch2() : notch(aligned, d2, fscSmall, fscSmallMax);

        double shift = offset * UNIT_SCALE;
        int[] opp = Arrays.stream(aligned)
                .filter(i -> fscSmall[i] > d1[i] * notch1 - shift && fscSmall[i] > d2[i] * notch2 - shift)
                .toArray();

        FilterParams effectiveParams = FilterParams.builder()
                .notch1(notch1)
                .notch2(notch2)
                .width(width)
                .offset(offset)
                .origin(origin)
                .build();
        LOG.debug("Retained {} of {} particles ({} aligned) with {}", opp.length, totalCount, aligned.length, effectiveParams);
        return new FilteredResult(evt.selectRows(opp), totalCount, effectiveParams);
    }

    /**
     * Among the aligned particles with the largest forward scatter take the smallest detector value; among the aligned
     * particles with that detector value take the largest forward scatter. The notch is the slope of the line from
     * (-10000, 0) to that point. Any row reaching an extreme gives the same value so ties do not matter.
     */
    private double notch(int[] aligned, double[] detector, double[] fscSmall, double fscSmallMax) {
        double minDetector = Arrays.stream(aligned)
                .filter(i -> fscSmall[i] == fscSmallMax)
                .mapToDouble(i -> detector[i])
                .min()
                .orElse(Double.NaN);
        double maxFscSmall = Arrays.stream(aligned)
                .filter(i -> detector[i] == minDetector)
                .mapToDouble(i -> fscSmall[i])
                .max()
                .orElse(Double.NaN);
        return maxFscSmall / (minDetector + NOTCH_DENOMINATOR_OFFSET);
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        } else {
            return (sorted[mid - 1] + sorted[mid]) / 2;
        }
    }
}
