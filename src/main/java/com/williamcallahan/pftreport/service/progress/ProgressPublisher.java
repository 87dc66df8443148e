package com.williamcallahan.pftreport.service.progress;

import com.williamcallahan.pftreport.config.AppProperties;
import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import com.williamcallahan.pftreport.service.registry.RegistryChangeListener;
import com.williamcallahan.pftreport.service.registry.RequestNotFoundException;
import com.williamcallahan.pftreport.service.registry.RequestRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Pushes status snapshots to live subscribers, keyed by request id.
 *
 * <p>A joining subscriber first receives the current snapshot, then one event per registry mutation,
 * with heartbeats in between. The stream completes after the terminal snapshot. Channels exist only
 * while someone is subscribed, and a slow subscriber only ever sees the newest pending snapshot.</p>
 */
@Service
public class ProgressPublisher implements RegistryChangeListener {
    private static final Logger log = LoggerFactory.getLogger(ProgressPublisher.class);

    private static final Counter DROPPED_HEARTBEAT_COUNTER =
            Metrics.counter("pftreport.progress.backpressure.dropped_heartbeats");

    private final RequestRegistry registry;
    private final Duration heartbeatInterval;
    private final Scheduler deliveryScheduler;
    private final ConcurrentMap<String, ProgressChannel> channels = new ConcurrentHashMap<>();

    @Autowired
    public ProgressPublisher(RequestRegistry registry, AppProperties appProperties) {
        this(registry, appProperties, Schedulers.boundedElastic());
    }

    /**
     * Creates a publisher that hands snapshots to subscribers on {@code deliveryScheduler}, so registry
     * writers never run subscriber code.
     */
    public ProgressPublisher(RequestRegistry registry, AppProperties appProperties, Scheduler deliveryScheduler) {
        this.registry = registry;
        this.heartbeatInterval = appProperties.getProgress().getHeartbeatInterval();
        this.deliveryScheduler = deliveryScheduler;
        registry.addListener(this);
    }

    /**
     * Opens a live stream for one request.
     *
     * @param requestId id returned at admission
     * @return events ending with the terminal snapshot; errors with {@link RequestNotFoundException}
     *     for unknown ids
     */
    public Flux<ProgressEvent> subscribe(String requestId) {
        return Flux.defer(() -> {
            ProcessingSnapshot current = registry.get(requestId);
            if (current.isTerminal()) {
                return Flux.just(ProgressEvent.snapshot(current));
            }
            ProgressChannel channel = attach(current);
            try {
                // Mutations landing between the read above and attach() had no channel to go to.
                registry.find(requestId).ifPresent(channel::offer);
            } catch (RuntimeException storeFailure) {
                detach(channel);
                throw storeFailure;
            }

            Flux<ProgressEvent> updates = channel.asFlux()
                    .onBackpressureLatest()
                    .publishOn(deliveryScheduler, 1)
                    .map(ProgressEvent::snapshot);
            Flux<ProgressEvent> heartbeats = Flux.interval(heartbeatInterval)
                    .onBackpressureDrop(ignoredTick -> DROPPED_HEARTBEAT_COUNTER.increment())
                    .map(tick -> channel.latest())
                    .filter(snapshot -> !snapshot.isTerminal())
                    .map(ProgressEvent::heartbeat);

            return Flux.merge(updates, heartbeats)
                    .takeUntil(ProgressEvent::isTerminalSnapshot)
                    .doFinally(signal -> detach(channel));
        });
    }

    @Override
    public void onSnapshot(ProcessingSnapshot snapshot) {
        ProgressChannel channel = channels.get(snapshot.requestId());
        if (channel == null) {
            return;
        }
        channel.offer(snapshot);
        if (channel.isClosed()) {
            channels.remove(snapshot.requestId(), channel);
        }
    }

    /**
     * Number of request ids with at least one live subscriber.
     */
    public int activeChannelCount() {
        return channels.size();
    }

    private ProgressChannel attach(ProcessingSnapshot current) {
        return channels.compute(current.requestId(), (requestId, existing) -> {
            ProgressChannel channel = existing == null || existing.isClosed() ? new ProgressChannel(current) : existing;
            channel.retain();
            return channel;
        });
    }

    private void detach(ProgressChannel channel) {
        channels.computeIfPresent(channel.requestId(), (requestId, existing) -> {
            if (existing != channel) {
                return existing;
            }
            int remaining = channel.release();
            if (remaining == 0 || channel.isClosed()) {
                log.debug("Closing progress channel for {}", requestId);
                return null;
            }
            return channel;
        });
    }
}
