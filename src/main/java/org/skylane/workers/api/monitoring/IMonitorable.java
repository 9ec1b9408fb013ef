package org.skylane.workers.api.monitoring;

import java.util.List;
import java.util.Map;

/**
 * An interface for components that can be monitored.
 * <p>
 * Channels, worker bodies and the worker manager expose their metrics, transient errors
 * and health through this interface so the orchestrator can report on them uniformly.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are metric names (e.g., "messages_put", "current_size") and the
     * values are the corresponding numeric values.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns a list of operational errors that have occurred in the component.
     * <p>
     * This list may be cleared by calling {@link #clearErrors()}.
     *
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors.
     */
    void clearErrors();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is in a degraded or failed state.
     */
    boolean isHealthy();
}
