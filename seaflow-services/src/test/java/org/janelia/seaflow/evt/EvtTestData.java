package org.janelia.seaflow.evt;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Particle rows and raw EVT bytes used across tests.
 */
public class EvtTestData {

    public static final String EVT_NAME = "2014_185/2014-07-04T00-00-02+00-00";

    public static double[] row(double time, double pulseWidth, double d1, double d2, double fscSmall,
                               double fscPerp, double fscBig, double pe, double chlSmall, double chlBig) {
        return new double[] {time, pulseWidth, d1, d2, fscSmall, fscPerp, fscBig, pe, chlSmall, chlBig};
    }

    public static double[] particle(double time, double d1, double d2, double fscSmall) {
        return row(time, 7, d1, d2, fscSmall, 100, 200, 300, 400, 500);
    }

    /**
     * Six particles: rows 0, 1 and 2 are focused, row 3 is not aligned, row 4 is not seen by the forward scatter
     * sensor and row 5 is aligned but below the notch line.
     */
    public static ParticleMatrix sampleParticles() {
        return ParticleMatrix.fromRows(
                particle(1, 1000, 1000, 30000),
                particle(2, 2000, 2000, 20000),
                particle(3, 3000, 3100, 10000),
                particle(4, 1000, 20000, 15000),
                particle(5, 0, 0, 1),
                particle(6, 40000, 40000, 5000));
    }

    /**
     * Raw EVT bytes with an explicit header count, which does not have to match the number of rows.
     */
    public static byte[] evtBytes(long headerCount, double[]... rows) {
        ByteBuffer buffer = ByteBuffer.allocate(4 + rows.length * 24).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt((int) headerCount);
        for (double[] row : rows) {
            buffer.putShort((short) 10);
            buffer.putShort((short) 0);
            for (double v : row) {
                buffer.putShort((short) (int) v);
            }
        }
        return buffer.array();
    }

    public static byte[] evtBytes(ParticleMatrix particles) {
        double[][] rows = new double[particles.getRowCount()][];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = particles.getRow(r);
        }
        return evtBytes(rows.length, rows);
    }
}
