package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;

/**
 * Observer notified synchronously after every accepted registry write.
 *
 * <p>Implementations run on the writer's thread and must not block.</p>
 */
@FunctionalInterface
public interface RegistryChangeListener {

    void onSnapshot(ProcessingSnapshot snapshot);
}
