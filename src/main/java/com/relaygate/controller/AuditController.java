package com.relaygate.controller;

import com.relaygate.entity.AuditRecordEntity;
import com.relaygate.repository.TierTotalsRow;
import com.relaygate.service.audit.AuditPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable audit records, for reconciliation against the in-memory metrics.
 * Range defaults to the last 24 hours.
 */
@Slf4j
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private static final Duration DEFAULT_RANGE = Duration.ofHours(24);

    private final AuditPersistenceService persistence;
    private final Clock clock;

    public AuditController(AuditPersistenceService persistence, Clock clock) {
        this.persistence = persistence;
        this.clock = clock;
    }

    /**
     * Audit records in [from, to), optionally for one tier.
     */
    @GetMapping
    public Mono<ResponseEntity<List<AuditRecordEntity>>> records(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(required = false) String tier) {
        Instant end = to != null ? to : Instant.now(clock);
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        checkRange(start, end);

        log.info("Audit: listing records from={} to={} tier={}", start, end, tier);
        return Mono.fromCallable(() -> persistence.find(start, end, tier))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    /**
     * Per-tier durable totals over [from, to).
     */
    @GetMapping("/reconcile")
    public Mono<ResponseEntity<List<TierTotalsRow>>> reconcile(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        Instant end = to != null ? to : Instant.now(clock);
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        checkRange(start, end);

        return Mono.fromCallable(() -> persistence.totalsByTier(start, end))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static void checkRange(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
    }
}
