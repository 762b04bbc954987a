package com.relaygate.service.metrics;

import com.relaygate.model.CallEvent;
import com.relaygate.service.audit.BatchAuditWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fans a finished call out to the aggregator (in-line) and the audit writer (queued).
 */
@Slf4j
@Service
public class CallRecorder {

    private final MetricsAggregator aggregator;
    private final BatchAuditWriter auditWriter;

    public CallRecorder(MetricsAggregator aggregator, BatchAuditWriter auditWriter) {
        this.aggregator = aggregator;
        this.auditWriter = auditWriter;
    }

    public void record(CallEvent event) {
        try {
            aggregator.record(event);
        } catch (RuntimeException e) {
            log.error("Failed to aggregate call event {}", event.getEventId(), e);
        }
        auditWriter.enqueue(event);
        log.debug("Recorded call {}: model={}, provider={}, hit={}, cost={}",
                event.getEventId(), event.getModel(), event.getProvider(), event.isCacheHit(), event.getCost());
    }
}
