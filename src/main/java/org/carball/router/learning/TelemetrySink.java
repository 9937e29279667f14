package org.carball.router.learning;

import org.carball.router.model.telemetry.ExecutionRecord;

/**
 * Receives one {@link ExecutionRecord} per finished query. Implementations
 * must return quickly and must not throw into the caller.
 */
public interface TelemetrySink {

    void record(ExecutionRecord record);
}
