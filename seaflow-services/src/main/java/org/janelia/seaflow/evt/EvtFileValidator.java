package org.janelia.seaflow.evt;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Checks that EVT files have a recognizable name and a well formed body without filtering them.
 */
public class EvtFileValidator {

    static final String OK_STATUS = "OK";
    static final String NOT_EVT_FILENAME_STATUS = "Filename does not look like an EVT file";

    public static class ValidationResult {
        private final String path;
        private final String status;
        private final Integer eventCount;

        ValidationResult(String path, String status, Integer eventCount) {
            this.path = path;
            this.status = status;
            this.eventCount = eventCount;
        }

        public String getPath() {
            return path;
        }

        public String getStatus() {
            return status;
        }

        public boolean isOk() {
            return eventCount != null;
        }

        /**
         * @return decoded row count or null if the file is not valid
         */
        public Integer getEventCount() {
            return eventCount;
        }

        @Override
        public String toString() {
            return new ToStringBuilder(this)
                    .append("path", path)
                    .append("status", status)
                    .append("eventCount", eventCount)
                    .toString();
        }
    }

    private final EvtCodec codec;

    public EvtFileValidator(EvtCodec codec) {
        this.codec = codec;
    }

    public ValidationResult validate(Path evtFile) {
        String path = evtFile.toString();
        if (!FileIdentity.isEvtFile(path)) {
            return new ValidationResult(path, NOT_EVT_FILENAME_STATUS, null);
        }
        try {
            ParticleMatrix particles = codec.read(evtFile);
            return new ValidationResult(path, OK_STATUS, particles.getRowCount());
        } catch (EvtFileException e) {
            return new ValidationResult(path, e.getMessage(), null);
        } catch (IOException e) {
            return new ValidationResult(path, "Could not read file: " + e.getMessage(), null);
        }
    }
}
