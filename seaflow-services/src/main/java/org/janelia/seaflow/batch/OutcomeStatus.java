package org.janelia.seaflow.batch;

public enum OutcomeStatus {
    OK(false),
    FORMAT_ERROR(false),
    FETCH_ERROR(false),
    UNEXPECTED_ERROR(false),
    CONFIG_ERROR(true), // a usage error; stops the run
    PERSISTENCE_ERROR(true); // never retried; stops the run

    private final boolean fatal;

    OutcomeStatus(boolean fatal) {
        this.fatal = fatal;
    }

    /**
     * @return true if a file with this outcome must stop the whole batch
     */
    public boolean isFatal() {
        return fatal;
    }
}
