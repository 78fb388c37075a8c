package com.stator;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every write here is a single conditional UPDATE so that concurrent runners
 * coordinate through the row itself. Callers check the affected row count.
 */
@Repository
public interface StatorRecordRepository extends JpaRepository<StatorRecord, UUID> {

    /**
     * Ready record count of one entity type.
     */
    interface ReadyCount {
        String getEntityType();

        Long getReadyCount();
    }

    Optional<StatorRecord> findByEntityTypeAndEntityKey(String entityType, String entityKey);

    @Query("""
            SELECT r FROM StatorRecord r
            WHERE r.entityType = :entityType
              AND r.ready = true
              AND r.state IN :states
              AND (r.leaseExpiresAt IS NULL OR r.leaseExpiresAt < :now)
            ORDER BY r.changedAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<StatorRecord> findReadyBatch(
            @Param("entityType") String entityType,
            @Param("states") Collection<String> states,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Query("""
            SELECT r.entityType AS entityType, COUNT(r) AS readyCount
            FROM StatorRecord r
            WHERE r.ready = true
            GROUP BY r.entityType
            """)
    List<ReadyCount> countReadyByEntityType();

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.leaseExpiresAt = :expiresAt,
                r.leasedBy = :owner,
                r.updatedAt = :now
            WHERE r.id = :id
              AND (r.leaseExpiresAt IS NULL OR r.leaseExpiresAt < :now)
            """)
    int acquireLease(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("expiresAt") OffsetDateTime expiresAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.leaseExpiresAt = NULL,
                r.leasedBy = NULL,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.leasedBy = :owner
            """)
    int releaseLease(@Param("id") UUID id, @Param("owner") String owner, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.leaseExpiresAt = :expiresAt,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.leasedBy = :owner
              AND r.leaseExpiresAt >= :now
            """)
    int extendLease(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("expiresAt") OffsetDateTime expiresAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.ready = false,
                r.attemptedAt = :now,
                r.attemptCount = r.attemptCount + 1,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.leasedBy = :owner
              AND r.leaseExpiresAt >= :now
            """)
    int recordAttempt(@Param("id") UUID id, @Param("owner") String owner, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.state = :toState,
                r.changedAt = :now,
                r.ready = true,
                r.attemptedAt = NULL,
                r.attemptCount = 0,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.state = :fromState
              AND r.leasedBy = :owner
            """)
    int applyTransition(
            @Param("id") UUID id,
            @Param("owner") String owner,
            @Param("fromState") String fromState,
            @Param("toState") String toState,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.ready = true,
                r.updatedAt = :now
            WHERE r.entityType = :entityType
              AND r.state = :state
              AND r.ready = false
              AND (r.attemptedAt IS NULL OR r.attemptedAt <= :cutoff)
            """)
    int markReadyForRetry(
            @Param("entityType") String entityType,
            @Param("state") String state,
            @Param("cutoff") OffsetDateTime cutoff,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.ready = true,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.ready = false
            """)
    int markReady(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.state = :toState,
                r.changedAt = :now,
                r.ready = true,
                r.attemptedAt = NULL,
                r.attemptCount = 0,
                r.updatedAt = :now
            WHERE r.id = :id
              AND r.state = :fromState
              AND (r.leaseExpiresAt IS NULL OR r.leaseExpiresAt < :now)
            """)
    int forceTransition(
            @Param("id") UUID id,
            @Param("fromState") String fromState,
            @Param("toState") String toState,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE StatorRecord r
            SET r.leaseExpiresAt = NULL,
                r.leasedBy = NULL,
                r.updatedAt = :now
            WHERE r.leaseExpiresAt < :now
            """)
    int clearExpiredLeases(@Param("now") OffsetDateTime now);
}
