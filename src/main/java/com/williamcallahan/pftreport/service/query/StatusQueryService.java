package com.williamcallahan.pftreport.service.query;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingStage;
import com.williamcallahan.pftreport.domain.report.PftReport;
import com.williamcallahan.pftreport.service.pipeline.ArtifactStore;
import com.williamcallahan.pftreport.service.registry.RequestNotFoundException;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Point reads of processing status and release of finished reports.
 */
@Service
public class StatusQueryService {
    private static final Logger log = LoggerFactory.getLogger(StatusQueryService.class);

    private final RequestRegistry registry;
    private final ArtifactStore artifactStore;

    public StatusQueryService(RequestRegistry registry, ArtifactStore artifactStore) {
        this.registry = registry;
        this.artifactStore = artifactStore;
    }

    /**
     * Reads the current status.
     *
     * @throws RequestNotFoundException when the id is unknown or expired
     */
    public ProcessingSnapshot status(String requestId) {
        return registry.get(requestId);
    }

    /**
     * Looks up the report, releasing it only once the run has COMPLETED.
     */
    public ResultLookup result(String requestId) {
        Optional<ProcessingSnapshot> found = registry.find(requestId);
        if (found.isEmpty()) {
            return new ResultLookup.NotFound(requestId);
        }
        ProcessingSnapshot snapshot = found.get();
        if (snapshot.stage() != ProcessingStage.COMPLETED) {
            return new ResultLookup.NotReady(snapshot);
        }
        Optional<PftReport> report = artifactStore.find(snapshot.resultRef());
        if (report.isEmpty()) {
            log.info("Report {} for request {} has expired", snapshot.resultRef(), requestId);
            return new ResultLookup.NotFound(requestId);
        }
        return new ResultLookup.Ready(report.get());
    }

    /**
     * Number of status entries currently retained; doubles as a store reachability probe.
     *
     * @throws com.williamcallahan.pftreport.service.registry.RegistryUnavailableException when the
     *     store cannot be read
     */
    public long trackedRequests() {
        return registry.size();
    }
}
