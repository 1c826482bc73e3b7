package com.questrail.telemetry.observability;

/**
 * Receives observability events from the decoding pipeline.
 * Implementations can provide logging, metrics, or capture for tests.
 *
 * <p>Callbacks are invoked on the pipeline's consumer thread and must not block.</p>
 */
public interface DecodeObservabilitySink {
    /**
     * Called when a fragment or frame is dropped and the decoder resynchronizes
     * on the next unit.
     */
    void onResync(DecodeResyncEvent event);

    /**
     * Called when a decoded packet is rejected by the filter stage.
     */
    void onFilterRejected(FilterRejectedEvent event);

    /**
     * Called on connect, disconnect and configuration changes.
     */
    void onSessionEvent(SessionLifecycleEvent event);

    /**
     * Called when an unexpected fault occurs in the pipeline.
     */
    void onError(DecodeErrorEvent event);
}
