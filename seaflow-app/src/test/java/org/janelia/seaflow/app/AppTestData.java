package org.janelia.seaflow.app;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.janelia.seaflow.evt.EvtCodec;
import org.janelia.seaflow.evt.ParticleMatrix;
import org.janelia.seaflow.utils.ArchiveUtils;

class AppTestData {

    static ParticleMatrix sampleParticles() {
        return ParticleMatrix.fromRows(
                new double[] {1, 7, 1000, 1000, 30000, 100, 200, 300, 400, 500},
                new double[] {2, 7, 2000, 2000, 20000, 100, 200, 300, 400, 500},
                new double[] {3, 7, 3000, 3100, 10000, 100, 200, 300, 400, 500},
                new double[] {4, 7, 1000, 20000, 15000, 100, 200, 300, 400, 500},
                new double[] {5, 7, 0, 0, 1, 100, 200, 300, 400, 500},
                new double[] {6, 7, 40000, 40000, 5000, 100, 200, 300, 400, 500});
    }

    /**
     * Write the sample particles; names ending in .gz are written gzip compressed.
     */
    static Path writeEvtFile(Path dir, String name) throws IOException {
        Path file = dir.resolve(name);
        try (OutputStream output = ArchiveUtils.openOutputStream(file, ArchiveUtils.isGzipped(name))) {
            new EvtCodec().write(sampleParticles(), output);
        }
        return file;
    }

    /**
     * The encoded sample particles as a remote store would return them for <code>name</code>.
     */
    static byte[] evtBytes(String name) throws IOException {
        byte[] content = new EvtCodec().encode(sampleParticles());
        if (!ArchiveUtils.isGzipped(name)) {
            return content;
        }
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (OutputStream output = new GzipCompressorOutputStream(compressed)) {
            output.write(content);
        }
        return compressed.toByteArray();
    }

    static Path write(Path dir, String name, byte[] content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content);
        return file;
    }
}
