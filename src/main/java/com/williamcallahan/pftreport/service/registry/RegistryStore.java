package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Backing store for status snapshots.
 *
 * <p>Implementations throw {@link RegistryUnavailableException} when the store cannot be reached.</p>
 */
public interface RegistryStore {

    Optional<ProcessingSnapshot> get(String requestId);

    /**
     * Inserts a new entry.
     *
     * @param snapshot initial snapshot
     * @return false when an entry already exists for the id
     */
    boolean insert(ProcessingSnapshot snapshot);

    /**
     * Atomically replaces the entry for {@code requestId} with {@code updater}'s result.
     *
     * <p>Updates for the same id are serialized. When {@code updater} throws, the stored value is left
     * as it was and the exception propagates.</p>
     *
     * @param requestId id of an existing entry
     * @param updater pure function from the current to the next snapshot
     * @return the stored result
     * @throws RequestNotFoundException when no entry exists
     */
    ProcessingSnapshot update(String requestId, UnaryOperator<ProcessingSnapshot> updater);

    long size();
}
