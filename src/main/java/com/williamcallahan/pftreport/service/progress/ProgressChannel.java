package com.williamcallahan.pftreport.service.progress;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Replay-latest fan-out for one request id.
 *
 * <p>Emissions are serialized by the channel's monitor and filtered by snapshot version, so
 * out-of-order or repeated deliveries never reach subscribers. The channel completes once a terminal
 * snapshot has been emitted.</p>
 */
final class ProgressChannel {
    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    private final String requestId;
    private final Sinks.Many<ProcessingSnapshot> sink = Sinks.many().replay().latest();
    private ProcessingSnapshot latest;
    private int subscribers;

    ProgressChannel(ProcessingSnapshot seed) {
        this.requestId = seed.requestId();
        offer(seed);
    }

    /**
     * Emits {@code snapshot} if it is newer than anything emitted so far.
     *
     * @return true when the snapshot was emitted
     */
    synchronized boolean offer(ProcessingSnapshot snapshot) {
        if (latest != null && (latest.isTerminal() || snapshot.version() <= latest.version())) {
            return false;
        }
        latest = snapshot;
        Sinks.EmitResult result = sink.tryEmitNext(snapshot);
        if (result.isFailure()) {
            log.debug("Progress emission for {} not delivered (result={})", requestId, result);
        }
        if (snapshot.isTerminal()) {
            sink.tryEmitComplete();
        }
        return true;
    }

    synchronized ProcessingSnapshot latest() {
        return latest;
    }

    synchronized boolean isClosed() {
        return latest != null && latest.isTerminal();
    }

    synchronized void retain() {
        subscribers++;
    }

    /**
     * @return subscribers still attached after this release
     */
    synchronized int release() {
        subscribers = Math.max(0, subscribers - 1);
        return subscribers;
    }

    Flux<ProcessingSnapshot> asFlux() {
        return sink.asFlux();
    }

    String requestId() {
        return requestId;
    }
}
