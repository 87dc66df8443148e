package com.williamcallahan.pftreport.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.williamcallahan.pftreport.service.admission.AdmissionScheduler;
import com.williamcallahan.pftreport.service.query.StatusQueryService;
import com.williamcallahan.pftreport.service.registry.RegistryUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

/**
 * Verifies that the actuator health check follows status store availability.
 */
class PipelineHealthIndicatorTest {

    @Test
    void health_reportsRunCountsWhenStoreIsReadable() {
        StatusQueryService statusQueryService = mock(StatusQueryService.class);
        AdmissionScheduler admissionScheduler = mock(AdmissionScheduler.class);
        when(statusQueryService.trackedRequests()).thenReturn(4L);
        when(admissionScheduler.activeRuns()).thenReturn(2);
        when(admissionScheduler.queuedRuns()).thenReturn(1);

        Health health = new PipelineHealthIndicator(statusQueryService, admissionScheduler).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(4L, health.getDetails().get("trackedRequests"));
        assertEquals(2, health.getDetails().get("activeRuns"));
        assertEquals(1, health.getDetails().get("queuedRuns"));
    }

    @Test
    void health_isDownWhenStoreIsUnavailable() {
        StatusQueryService statusQueryService = mock(StatusQueryService.class);
        AdmissionScheduler admissionScheduler = mock(AdmissionScheduler.class);
        when(statusQueryService.trackedRequests()).thenThrow(new RegistryUnavailableException("store offline"));

        Health health = new PipelineHealthIndicator(statusQueryService, admissionScheduler).health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Status store unavailable", health.getDetails().get("status"));
    }
}
