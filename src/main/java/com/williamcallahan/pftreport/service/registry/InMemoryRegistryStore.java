package com.williamcallahan.pftreport.service.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local registry store backed by Caffeine; entries expire after the configured retention.
 */
@Component
public class InMemoryRegistryStore implements RegistryStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRegistryStore.class);

    private final Cache<String, ProcessingSnapshot> entries;

    public InMemoryRegistryStore(AppProperties appProperties) {
        AppProperties.Registry registrySettings = appProperties.getRegistry();
        this.entries = Caffeine.newBuilder()
                .maximumSize(registrySettings.getMaxEntries())
                .expireAfterWrite(registrySettings.getRetention())
                .build();
        log.info("In-memory registry store initialized (retention={}, maxEntries={})",
                registrySettings.getRetention(), registrySettings.getMaxEntries());
    }

    @Override
    public Optional<ProcessingSnapshot> get(String requestId) {
        return Optional.ofNullable(entries.getIfPresent(requestId));
    }

    @Override
    public boolean insert(ProcessingSnapshot snapshot) {
        return entries.asMap().putIfAbsent(snapshot.requestId(), snapshot) == null;
    }

    @Override
    public ProcessingSnapshot update(String requestId, UnaryOperator<ProcessingSnapshot> updater) {
        return entries.asMap().compute(requestId, (id, current) -> {
            if (current == null) {
                throw new RequestNotFoundException(id);
            }
            return updater.apply(current);
        });
    }

    @Override
    public long size() {
        return entries.estimatedSize();
    }
}
