package com.williamcallahan.pftreport.service.pipeline;

import com.williamcallahan.pftreport.domain.report.PftReport;
import java.util.Optional;

/**
 * Holds finished reports until they are fetched or expire.
 */
public interface ArtifactStore {

    /**
     * Stores a report.
     *
     * @param report finished report
     * @return opaque handle recorded as the status entry's result reference
     */
    String store(PftReport report);

    Optional<PftReport> find(String resultRef);
}
