package com.williamcallahan.pftreport.service.pipeline;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.report.PftReport;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed report store. Reports expire after the configured retention.
 */
@Component
public class InMemoryArtifactStore implements ArtifactStore {

    private static final String REF_PREFIX = "report:";

    private final Cache<String, PftReport> reports;

    public InMemoryArtifactStore(AppProperties appProperties) {
        AppProperties.Artifacts artifactSettings = appProperties.getArtifacts();
        this.reports = Caffeine.newBuilder()
                .maximumSize(artifactSettings.getMaxEntries())
                .expireAfterWrite(artifactSettings.getRetention())
                .build();
    }

    @Override
    public String store(PftReport report) {
        String resultRef = REF_PREFIX + report.reportId();
        reports.put(resultRef, report);
        return resultRef;
    }

    @Override
    public Optional<PftReport> find(String resultRef) {
        if (resultRef == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(reports.getIfPresent(resultRef));
    }
}
