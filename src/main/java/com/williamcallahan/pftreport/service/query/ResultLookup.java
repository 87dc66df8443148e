package com.williamcallahan.pftreport.service.query;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.report.PftReport;
import java.util.Objects;

/**
 * Outcome of asking for a request's report.
 */
public sealed interface ResultLookup permits ResultLookup.Ready, ResultLookup.NotReady, ResultLookup.NotFound {

    /** The run completed and the report is available. */
    record Ready(PftReport report) implements ResultLookup {
        public Ready {
            Objects.requireNonNull(report, "Report is required");
        }
    }

    /** The run is still in progress or has failed; no partial output is released. */
    record NotReady(ProcessingSnapshot snapshot) implements ResultLookup {
        public NotReady {
            Objects.requireNonNull(snapshot, "Snapshot is required");
        }
    }

    /** The id is unknown, or the report has expired. */
    record NotFound(String requestId) implements ResultLookup {}
}
