package com.williamcallahan.pftreport.service.registry;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Single source of truth for per-request processing status.
 *
 * <p>Every write goes through a {@link StatusMutation}, so the stage order, monotone progress and
 * terminal immutability hold no matter which component writes. Accepted writes are fanned out to
 * {@link RegistryChangeListener}s on the writer's thread.</p>
 */
@Service
public class RequestRegistry {
    private static final Logger log = LoggerFactory.getLogger(RequestRegistry.class);

    private final RegistryStore store;
    private final Clock clock;
    private final List<RegistryChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public RequestRegistry(RegistryStore store) {
        this(store, Clock.systemUTC());
    }

    public RequestRegistry(RegistryStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "Registry store is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
    }

    /**
     * Inserts the QUEUED entry for a newly admitted request.
     *
     * @param requestId freshly allocated id
     * @return the stored QUEUED snapshot
     * @throws DuplicateRequestException when the id is already registered
     * @throws RegistryUnavailableException when the store cannot be reached
     */
    public ProcessingSnapshot create(String requestId) {
        ProcessingSnapshot queued = ProcessingSnapshot.queued(requestId, clock.instant());
        if (!store.insert(queued)) {
            throw new DuplicateRequestException(requestId);
        }
        log.debug("Registered request {}", requestId);
        notifyListeners(queued);
        return queued;
    }

    public Optional<ProcessingSnapshot> find(String requestId) {
        return store.get(requestId);
    }

    /**
     * Reads the current snapshot.
     *
     * @throws RequestNotFoundException when the id is unknown or expired
     */
    public ProcessingSnapshot get(String requestId) {
        return store.get(requestId).orElseThrow(() -> new RequestNotFoundException(requestId));
    }

    /**
     * Applies a mutation atomically and notifies listeners with the result.
     *
     * @param requestId id of an existing request
     * @param mutation change to apply
     * @return the new snapshot
     */
    public ProcessingSnapshot update(String requestId, StatusMutation mutation) {
        Objects.requireNonNull(mutation, "Mutation is required");
        ProcessingSnapshot updated = store.update(requestId, current -> mutation.applyTo(current, clock.instant()));
        log.debug("Request {} -> {} ({}%, v{})",
                requestId, updated.stage(), updated.progress(), updated.version());
        notifyListeners(updated);
        return updated;
    }

    public void addListener(RegistryChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener is required"));
    }

    public void removeListener(RegistryChangeListener listener) {
        listeners.remove(listener);
    }

    public long size() {
        return store.size();
    }

    private void notifyListeners(ProcessingSnapshot snapshot) {
        for (RegistryChangeListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (RuntimeException listenerFailure) {
                log.warn("Registry listener failed for request {} (exceptionType={})",
                        snapshot.requestId(), listenerFailure.getClass().getSimpleName(), listenerFailure);
            }
        }
    }
}
