package org.skylane.workers.bodies;

import java.time.Instant;

/**
 * A liveness message emitted periodically by a {@link HeartbeatWorker}.
 *
 * @param source    The replica that emitted the heartbeat.
 * @param sequence  Number of heartbeats emitted before this one by the same replica.
 * @param timestamp When the heartbeat was emitted.
 */
public record Heartbeat(String source, long sequence, Instant timestamp) {
}
