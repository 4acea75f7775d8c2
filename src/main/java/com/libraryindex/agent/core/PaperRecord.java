package com.libraryindex.agent.core;

import com.libraryindex.agent.search.PaperMetadata;
import lombok.extern.slf4j.Slf4j;

/**
 * One candidate paper within a session.
 *
 * Status only moves forward; an illegal transition is ignored and reported
 * as {@code false}. Methods are synchronized because the owning analyzer and
 * the orchestrator (timeouts) may both try to settle the record.
 */
@Slf4j
public class PaperRecord {

    private final String id;
    private PaperMetadata metadata;
    private PaperStatus status = PaperStatus.PENDING;
    private String analysisText;
    private String error;
    private boolean fromCache;

    public PaperRecord(PaperMetadata metadata) {
        this.id = metadata.getId();
        this.metadata = metadata;
    }

    public String getId() {
        return id;
    }

    public synchronized PaperMetadata getMetadata() {
        return metadata;
    }

    public synchronized PaperStatus getStatus() {
        return status;
    }

    /** Present only when status is ANALYZED. */
    public synchronized String getAnalysisText() {
        return status == PaperStatus.ANALYZED ? analysisText : null;
    }

    public synchronized String getError() {
        return error;
    }

    public synchronized boolean isFromCache() {
        return fromCache;
    }

    /** Re-encountering the same paper only fills metadata gaps; status is untouched. */
    public synchronized void mergeMetadata(PaperMetadata other) {
        this.metadata = metadata.mergedWith(other);
    }

    public synchronized boolean markFetched() {
        return advance(PaperStatus.FETCHED);
    }

    public synchronized boolean markAnalyzed(String text, boolean cached) {
        if (!advance(PaperStatus.ANALYZED)) {
            return false;
        }
        this.analysisText = text;
        this.fromCache = cached;
        return true;
    }

    public synchronized boolean markFailed(String reason) {
        if (!advance(PaperStatus.FAILED)) {
            return false;
        }
        this.error = reason;
        return true;
    }

    private boolean advance(PaperStatus next) {
        if (!status.canAdvanceTo(next)) {
            log.debug("Ignored status change {} → {} for paper {}", status, next, id);
            return false;
        }
        status = next;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "PaperRecord[" + id + ", " + status + "]";
    }
}
