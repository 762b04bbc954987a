package com.relaygate.service.audit;

import com.relaygate.entity.AuditRecordEntity;
import com.relaygate.model.CallEvent;
import com.relaygate.repository.AuditRecordRepository;
import com.relaygate.repository.TierTotalsRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable store access for audit records. Writes are idempotent on event id.
 */
@Slf4j
@Service
public class AuditPersistenceService {

    private final AuditRecordRepository repository;
    private final Clock clock;

    public AuditPersistenceService(AuditRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Write a batch in one bulk insert, skipping events that are already stored.
     *
     * @return number of new rows
     */
    @Transactional
    public int persist(List<CallEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }
        Map<String, CallEvent> unique = new LinkedHashMap<>();
        for (CallEvent event : events) {
            unique.putIfAbsent(event.getEventId(), event);
        }
        Set<String> existing = new HashSet<>(repository.findExistingEventIds(unique.keySet()));

        Instant writtenAt = Instant.now(clock);
        List<AuditRecordEntity> rows = unique.values().stream()
                .filter(e -> !existing.contains(e.getEventId()))
                .map(e -> toEntity(e, writtenAt))
                .toList();

        repository.saveAll(rows);
        if (!existing.isEmpty()) {
            log.debug("Skipped {} already persisted audit records", existing.size());
        }
        return rows.size();
    }

    @Transactional(readOnly = true)
    public List<AuditRecordEntity> find(Instant from, Instant to, String tier) {
        if (tier == null || tier.isBlank()) {
            return repository.findInRange(from, to);
        }
        return repository.findInRangeByTier(tier, from, to);
    }

    @Transactional(readOnly = true)
    public List<TierTotalsRow> totalsByTier(Instant from, Instant to) {
        return repository.sumByTier(from, to);
    }

    @Transactional
    public int deleteOlderThan(Instant cutoff) {
        return repository.deleteOlderThan(cutoff);
    }

    static AuditRecordEntity toEntity(CallEvent event, Instant writtenAt) {
        return AuditRecordEntity.builder()
                .eventId(event.getEventId())
                .eventTimestamp(event.getTimestamp())
                .writtenAt(writtenAt)
                .requestId(event.getRequestId())
                .source(event.getSource())
                .agentType(event.getAgentType())
                .requestedModel(event.getRequestedModel())
                .model(event.getModel())
                .provider(event.getProvider())
                .tier(event.getTier())
                .inputTokens(event.getInputTokens())
                .outputTokens(event.getOutputTokens())
                .cacheWriteTokens(event.getCacheWriteTokens())
                .cacheReadTokens(event.getCacheReadTokens())
                .costUsd(event.getCost())
                .wouldBeCostUsd(event.getWouldBeCost())
                .savingsUsd(event.getSavings())
                .latencyMs(event.getLatencyMs())
                .ttfbMs(event.getTtfbMs())
                .cacheHit(event.isCacheHit())
                .streamed(event.isStreamed())
                .success(event.isSuccess())
                .errorCode(event.getErrorCode())
                .build();
    }
}
