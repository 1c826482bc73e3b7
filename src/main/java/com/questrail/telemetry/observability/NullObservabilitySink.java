package com.questrail.telemetry.observability;

/**
 * No-op implementation of DecodeObservabilitySink.
 */
public final class NullObservabilitySink implements DecodeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onResync(DecodeResyncEvent event) {}

    @Override
    public void onFilterRejected(FilterRejectedEvent event) {}

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {}

    @Override
    public void onError(DecodeErrorEvent event) {}
}
