package com.questrail.telemetry.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DecodeObservabilitySink that emits logs via SLF4J.
 *
 * <p>Resyncs and ordinary filter rejections are routine on a noisy serial line
 * and log at DEBUG; a filter that throws logs at WARN.</p>
 */
public final class Slf4jDecodeObservabilitySink implements DecodeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDecodeObservabilitySink.class);

    @Override
    public void onResync(DecodeResyncEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Type {} resync: {} [{}]", event.format().code(), event.reason(), event.unit());
        }
    }

    @Override
    public void onFilterRejected(FilterRejectedEvent event) {
        if (event.cause() != null) {
            log.warn("Filter failed on packet {}: {}", event.packetId(), event.reason(), event.cause());
        }
        else {
            log.debug("Filter rejected packet {}: {}", event.packetId(), event.reason());
        }
    }

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {
        log.info("Session {}: {}", event.kind(), event.detail());
    }

    @Override
    public void onError(DecodeErrorEvent event) {
        log.error("Decoding error: {}", event.message(), event.cause());
    }
}
