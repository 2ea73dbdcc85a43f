package org.janelia.seaflow.evt;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.common.io.ByteStreams;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.janelia.seaflow.utils.ArchiveUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes the LabVIEW binary EVT layout.
 * <p>
 * A file starts with an unsigned 32-bit little-endian particle count followed by one row of twelve unsigned 16-bit
 * little-endian values per particle. The first two values of every row are padding (10 and 0); the remaining ten are
 * the {@link EvtChannel} values in declaration order.
 */
public class EvtCodec {

    private static final Logger LOG = LoggerFactory.getLogger(EvtCodec.class);

    static final int HEADER_BYTES = 4;
    static final int WORDS_PER_ROW = 12;
    static final int BYTES_PER_WORD = 2;
    static final int BYTES_PER_ROW = WORDS_PER_ROW * BYTES_PER_WORD;
    static final short LEADING_PAD = 10;
    static final short TRAILING_PAD = 0;

    /**
     * Decode raw, uncompressed EVT bytes.
     *
     * @throws EvtFileException if the data is empty, the header is short or zero, or the body size does not match it
     */
    public ParticleMatrix decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new EvtFileException("File is empty");
        }
        if (data.length < HEADER_BYTES) {
            throw new EvtFileException("File has invalid particle count header");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        long rowCount = Integer.toUnsignedLong(buffer.getInt());
        if (rowCount == 0) {
            throw new EvtFileException("File has no particle data");
        }
        long expectedBytes = rowCount * BYTES_PER_ROW;
        long actualBytes = data.length - HEADER_BYTES;
        if (actualBytes != expectedBytes) {
            throw new EvtFileException(String.format(
                    "File has incorrect number of data bytes. Expected %d, saw %d", expectedBytes, actualBytes));
        }
        int rows = (int) rowCount;
        double[] values = new double[rows * EvtChannel.COUNT];
        int index = 0;
        for (int r = 0; r < rows; r++) {
            // skip the two padding words
            buffer.position(buffer.position() + 2 * BYTES_PER_WORD);
            for (int c = 0; c < EvtChannel.COUNT; c++) {
                values[index++] = Short.toUnsignedInt(buffer.getShort());
            }
        }
        return new ParticleMatrix(values, rows, rowCount);
    }

    /**
     * Decode bytes that came from the named source; a ".gz" name means the bytes are gzip compressed.
     */
    public ParticleMatrix decode(String name, byte[] data) {
        if (ArchiveUtils.isGzipped(name)) {
            return decode(gunzip(name, data));
        } else {
            return decode(data);
        }
    }

    public ParticleMatrix read(Path evtFile) throws IOException {
        LOG.debug("Read EVT data from {}", evtFile);
        try (InputStream evtStream = Files.newInputStream(evtFile)) {
            return decode(evtFile.toString(), ByteStreams.toByteArray(evtStream));
        }
    }

    public byte[] encode(ParticleMatrix particles) {
        ByteArrayOutputStream output = new ByteArrayOutputStream(HEADER_BYTES + particles.getRowCount() * BYTES_PER_ROW);
        try {
            write(particles, output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return output.toByteArray();
    }

    /**
     * Write the particles with a header equal to their row count, restoring the per row padding.
     * Values are narrowed back to unsigned 16-bit integers.
     */
    public void write(ParticleMatrix particles, OutputStream output) throws IOException {
        int rows = particles.getRowCount();
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + rows * BYTES_PER_ROW).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(rows);
        for (int r = 0; r < rows; r++) {
            buffer.putShort(LEADING_PAD);
            buffer.putShort(TRAILING_PAD);
            for (EvtChannel channel : EvtChannel.values()) {
                buffer.putShort((short) (long) particles.get(r, channel));
            }
        }
        output.write(buffer.array());
    }

    private byte[] gunzip(String name, byte[] data) {
        try (InputStream gzStream = new GzipCompressorInputStream(new ByteArrayInputStream(data))) {
            return ByteStreams.toByteArray(gzStream);
        } catch (IOException e) {
            throw new EvtFileException("Could not decompress " + name + ": " + e.getMessage(), e);
        }
    }
}
