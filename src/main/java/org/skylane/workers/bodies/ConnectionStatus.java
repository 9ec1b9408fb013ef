package org.skylane.workers.bodies;

import java.time.Instant;

/**
 * A change of the link state observed by a {@link HeartbeatMonitorWorker}.
 *
 * @param monitor          The replica that observed the change.
 * @param connected        Whether heartbeats are arriving.
 * @param missedHeartbeats Consecutive heartbeat periods without a heartbeat.
 * @param timestamp        When the change was observed.
 */
public record ConnectionStatus(String monitor, boolean connected, int missedHeartbeats, Instant timestamp) {

    @Override
    public String toString() {
        return (connected ? "Connected" : "Disconnected") + " (" + monitor + ", missed=" + missedHeartbeats + ")";
    }
}
