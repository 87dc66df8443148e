package com.williamcallahan.pftreport.config;

import com.williamcallahan.pftreport.service.admission.AdmissionScheduler;
import com.williamcallahan.pftreport.service.query.StatusQueryService;
import com.williamcallahan.pftreport.service.registry.RegistryUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Spring Actuator health indicator for the processing pipeline.
 *
 * <p>Reports DOWN while the status store cannot be read, since no submission can be admitted and
 * no status can be answered in that state.</p>
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private static final String DETAIL_KEY_STATUS = "status";
    private static final String DETAIL_KEY_TRACKED = "trackedRequests";
    private static final String DETAIL_KEY_ACTIVE = "activeRuns";
    private static final String DETAIL_KEY_QUEUED = "queuedRuns";

    private final StatusQueryService statusQueryService;
    private final AdmissionScheduler admissionScheduler;

    public PipelineHealthIndicator(StatusQueryService statusQueryService, AdmissionScheduler admissionScheduler) {
        this.statusQueryService = statusQueryService;
        this.admissionScheduler = admissionScheduler;
    }

    /**
     * Probes the status store and reports run counts.
     *
     * @return Health.UP when the store is readable, Health.DOWN otherwise
     */
    @Override
    public Health health() {
        long trackedRequests;
        try {
            trackedRequests = statusQueryService.trackedRequests();
        } catch (RegistryUnavailableException unavailable) {
            return Health.down(unavailable)
                    .withDetail(DETAIL_KEY_STATUS, "Status store unavailable")
                    .build();
        }
        return Health.up()
                .withDetail(DETAIL_KEY_STATUS, "Accepting submissions")
                .withDetail(DETAIL_KEY_TRACKED, trackedRequests)
                .withDetail(DETAIL_KEY_ACTIVE, admissionScheduler.activeRuns())
                .withDetail(DETAIL_KEY_QUEUED, admissionScheduler.queuedRuns())
                .build();
    }
}
