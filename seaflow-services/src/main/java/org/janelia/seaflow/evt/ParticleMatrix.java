package org.janelia.seaflow.evt;

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Immutable particle table: one row per detected particle, one column per {@link EvtChannel}.
 * Rows are kept in acquisition order.
 */
public class ParticleMatrix {

    private static final ParticleMatrix EMPTY = new ParticleMatrix(new double[0], 0, 0);

    private final double[] values; // row major
    private final int rowCount;
    private final long headerCount;

    ParticleMatrix(double[] values, int rowCount, long headerCount) {
        this.values = values;
        this.rowCount = rowCount;
        this.headerCount = headerCount;
    }

    public static ParticleMatrix empty() {
        return EMPTY;
    }

    /**
     * Build a matrix from explicit rows. Each row must have one value per channel.
     */
    public static ParticleMatrix fromRows(double[]... rows) {
        double[] values = new double[rows.length * EvtChannel.COUNT];
        for (int r = 0; r < rows.length; r++) {
            Preconditions.checkArgument(rows[r].length == EvtChannel.COUNT,
                    "Row %s has %s values instead of %s", r, rows[r].length, EvtChannel.COUNT);
            System.arraycopy(rows[r], 0, values, r * EvtChannel.COUNT, EvtChannel.COUNT);
        }
        return new ParticleMatrix(values, rows.length, rows.length);
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * @return the particle count declared by the file header this matrix was decoded from
     */
    public long getHeaderCount() {
        return headerCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public double get(int row, EvtChannel channel) {
        Preconditions.checkElementIndex(row, rowCount);
        return values[row * EvtChannel.COUNT + channel.ordinal()];
    }

    public double[] getRow(int row) {
        Preconditions.checkElementIndex(row, rowCount);
        int start = row * EvtChannel.COUNT;
        return Arrays.copyOfRange(values, start, start + EvtChannel.COUNT);
    }

    public double[] getColumn(EvtChannel channel) {
        double[] column = new double[rowCount];
        for (int r = 0; r < rowCount; r++) {
            column[r] = values[r * EvtChannel.COUNT + channel.ordinal()];
        }
        return column;
    }

    /**
     * Select the given rows, in the given order, into a new matrix.
     */
    public ParticleMatrix selectRows(int[] rowIndexes) {
        double[] selected = new double[rowIndexes.length * EvtChannel.COUNT];
        for (int i = 0; i < rowIndexes.length; i++) {
            Preconditions.checkElementIndex(rowIndexes[i], rowCount);
            System.arraycopy(values, rowIndexes[i] * EvtChannel.COUNT, selected, i * EvtChannel.COUNT, EvtChannel.COUNT);
        }
        return new ParticleMatrix(selected, rowIndexes.length, rowIndexes.length);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("rowCount", rowCount)
                .append("headerCount", headerCount)
                .toString();
    }
}
