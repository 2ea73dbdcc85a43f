package org.janelia.seaflow.batch;

import java.util.Optional;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Result of processing one EVT file reference.
 */
public class FileOutcome {

    private final String reference;
    private final OutcomeStatus status;
    private final int evtCount;
    private final int oppCount;
    private final Throwable error;

    private FileOutcome(String reference, OutcomeStatus status, int evtCount, int oppCount, Throwable error) {
        this.reference = reference;
        this.status = status;
        this.evtCount = evtCount;
        this.oppCount = oppCount;
        this.error = error;
    }

    public static FileOutcome ok(String reference, int evtCount, int oppCount) {
        return new FileOutcome(reference, OutcomeStatus.OK, evtCount, oppCount, null);
    }

    public static FileOutcome failed(String reference, OutcomeStatus status, Throwable error) {
        return new FileOutcome(reference, status, 0, 0, error);
    }

    public String getReference() {
        return reference;
    }

    public OutcomeStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == OutcomeStatus.OK;
    }

    public int getEvtCount() {
        return evtCount;
    }

    public int getOppCount() {
        return oppCount;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("reference", reference)
                .append("status", status)
                .append("evtCount", evtCount)
                .append("oppCount", oppCount)
                .append("error", getErrorMessage())
                .toString();
    }
}
