package com.relaygate.service.audit;

import com.relaygate.config.RelaygateProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes audit records older than the retention window.
 */
@Slf4j
@Service
public class AuditRetentionService {

    private final AuditPersistenceService persistence;
    private final Clock clock;
    private final Duration retention;

    public AuditRetentionService(AuditPersistenceService persistence, Clock clock, RelaygateProperties properties) {
        this.persistence = persistence;
        this.clock = clock;
        this.retention = properties.getAudit().getRetention();
    }

    @Scheduled(initialDelayString = "${relaygate.audit.retention-sweep-interval:PT1H}",
            fixedDelayString = "${relaygate.audit.retention-sweep-interval:PT1H}")
    public void sweep() {
        Instant cutoff = Instant.now(clock).minus(retention);
        try {
            int deleted = persistence.deleteOlderThan(cutoff);
            if (deleted > 0) {
                log.info("Retention sweep removed {} audit records older than {}", deleted, cutoff);
            }
        } catch (RuntimeException e) {
            log.warn("Retention sweep failed, will retry next cycle: {}", e.getMessage());
        }
    }
}
