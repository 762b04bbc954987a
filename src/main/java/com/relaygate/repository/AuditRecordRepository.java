package com.relaygate.repository;

import com.relaygate.entity.AuditRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for durable audit records.
 */
@Repository
public interface AuditRecordRepository extends JpaRepository<AuditRecordEntity, Long> {

    /**
     * Which of the given event ids are already stored.
     */
    @Query("SELECT a.eventId FROM AuditRecordEntity a WHERE a.eventId IN :eventIds")
    List<String> findExistingEventIds(@Param("eventIds") Collection<String> eventIds);

    /**
     * Records in [from, to), oldest first.
     */
    @Query("SELECT a FROM AuditRecordEntity a WHERE a.eventTimestamp >= :from AND a.eventTimestamp < :to " +
            "ORDER BY a.eventTimestamp ASC")
    List<AuditRecordEntity> findInRange(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Records of one tier in [from, to), oldest first.
     */
    @Query("SELECT a FROM AuditRecordEntity a WHERE a.tier = :tier " +
            "AND a.eventTimestamp >= :from AND a.eventTimestamp < :to ORDER BY a.eventTimestamp ASC")
    List<AuditRecordEntity> findInRangeByTier(@Param("tier") String tier,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    /**
     * Per-tier durable totals in [from, to) for reconciliation against the in-memory view.
     */
    @Query("SELECT new com.relaygate.repository.TierTotalsRow(a.tier, COUNT(a), " +
            "SUM(a.costUsd), SUM(a.savingsUsd), SUM(a.inputTokens), SUM(a.outputTokens)) " +
            "FROM AuditRecordEntity a WHERE a.eventTimestamp >= :from AND a.eventTimestamp < :to " +
            "GROUP BY a.tier ORDER BY a.tier")
    List<TierTotalsRow> sumByTier(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Delete records older than the cutoff (retention).
     */
    @Modifying
    @Query("DELETE FROM AuditRecordEntity a WHERE a.eventTimestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
