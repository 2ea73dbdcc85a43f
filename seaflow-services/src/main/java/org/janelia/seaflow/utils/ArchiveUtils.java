package org.janelia.seaflow.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared utility methods for dealing with gzip compressed files.
 */
public class ArchiveUtils {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveUtils.class);

    public static final String EXTENSION_GZIP = ".gz";

    public static boolean isGzipped(String filepath) {
        return filepath != null && filepath.endsWith(EXTENSION_GZIP);
    }

    /**
     * Open a stream for writing the given file, creating missing parent directories.
     * When <code>gzip</code> is set the content is gzip compressed.
     */
    public static OutputStream openOutputStream(Path file, boolean gzip) throws IOException {
        Path parentDir = file.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        OutputStream fileStream = Files.newOutputStream(file);
        if (gzip) {
            return new GzipCompressorOutputStream(fileStream);
        } else {
            return fileStream;
        }
    }

    /**
     * Compress <code>file</code> into a sibling file with a .gz extension and remove the original.
     *
     * @return the path of the compressed file
     */
    public static Path gzipFile(Path file) throws IOException {
        Path gzFile = Paths.get(file.toString() + EXTENSION_GZIP);
        long startTime = System.currentTimeMillis();
        try (InputStream input = Files.newInputStream(file);
             OutputStream output = openOutputStream(gzFile, true)) {
            input.transferTo(output);
        }
        Files.delete(file);
        LOG.info("Compressed {} to {} in {}secs", file, gzFile, (System.currentTimeMillis() - startTime) / 1000.);
        return gzFile;
    }
}
