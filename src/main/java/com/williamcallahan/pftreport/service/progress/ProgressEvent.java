package com.williamcallahan.pftreport.service.progress;

import com.williamcallahan.pftreport.domain.pipeline.ProcessingSnapshot;
import java.util.Objects;

/**
 * One element of a live progress stream.
 *
 * @param type whether the event reports a change or is a keepalive
 * @param snapshot snapshot current at emission time
 */
public record ProgressEvent(Type type, ProcessingSnapshot snapshot) {

    public ProgressEvent {
        Objects.requireNonNull(type, "Event type is required");
        Objects.requireNonNull(snapshot, "Snapshot is required");
    }

    public static ProgressEvent snapshot(ProcessingSnapshot snapshot) {
        return new ProgressEvent(Type.SNAPSHOT, snapshot);
    }

    public static ProgressEvent heartbeat(ProcessingSnapshot snapshot) {
        return new ProgressEvent(Type.HEARTBEAT, snapshot);
    }

    public boolean isTerminalSnapshot() {
        return type == Type.SNAPSHOT && snapshot.isTerminal();
    }

    /** Event kinds. */
    public enum Type {
        SNAPSHOT,
        HEARTBEAT
    }
}
