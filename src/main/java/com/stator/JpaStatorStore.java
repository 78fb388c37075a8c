package com.stator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaStatorStore implements StatorStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStatorStore.class);

    private final StatorRecordRepository repository;
    private final TransactionTemplate transactionTemplate;

    public JpaStatorStore(StatorRecordRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public StatorRecord create(String entityType, String entityKey, String initialState, OffsetDateTime now) {
        Optional<StatorRecord> existing = repository.findByEntityTypeAndEntityKey(entityType, entityKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        StatorRecord record = new StatorRecord(UUID.randomUUID(), entityType, entityKey, initialState, now);
        try {
            return transactionTemplate.execute(status -> repository.saveAndFlush(record));
        } catch (DataIntegrityViolationException duplicate) {
            // Lost the insert race against another creator of the same key.
            log.debug("Record {}#{} was created concurrently; returning the stored one", entityType, entityKey);
            return repository.findByEntityTypeAndEntityKey(entityType, entityKey).orElseThrow(() -> duplicate);
        }
    }

    @Override
    public Optional<StatorRecord> findById(UUID id) {
        return repository.findById(id);
    }

    @Override
    public Optional<StatorRecord> findByKey(String entityType, String entityKey) {
        return repository.findByEntityTypeAndEntityKey(entityType, entityKey);
    }

    @Override
    public List<StatorRecord> fetchReadyBatch(String entityType, Collection<String> states, int limit,
            OffsetDateTime now) {
        if (states.isEmpty() || limit <= 0) {
            return List.of();
        }
        return repository.findReadyBatch(entityType, states, now, PageRequest.of(0, limit));
    }

    @Override
    public boolean tryAcquireLease(UUID id, String owner, OffsetDateTime expiresAt, OffsetDateTime now) {
        return update(() -> repository.acquireLease(id, owner, expiresAt, now)) > 0;
    }

    @Override
    public boolean releaseLease(UUID id, String owner, OffsetDateTime now) {
        return update(() -> repository.releaseLease(id, owner, now)) > 0;
    }

    @Override
    public boolean extendLease(UUID id, String owner, OffsetDateTime expiresAt, OffsetDateTime now) {
        return update(() -> repository.extendLease(id, owner, expiresAt, now)) > 0;
    }

    @Override
    public boolean recordAttempt(UUID id, String owner, OffsetDateTime now) {
        return update(() -> repository.recordAttempt(id, owner, now)) > 0;
    }

    @Override
    public boolean applyTransition(UUID id, String owner, String fromState, String toState, OffsetDateTime now) {
        return update(() -> repository.applyTransition(id, owner, fromState, toState, now)) > 0;
    }

    @Override
    public int bulkMarkReady(String entityType, String state, OffsetDateTime cutoff, OffsetDateTime now) {
        return update(() -> repository.markReadyForRetry(entityType, state, cutoff, now));
    }

    @Override
    public boolean markReady(UUID id, OffsetDateTime now) {
        return update(() -> repository.markReady(id, now)) > 0;
    }

    @Override
    public boolean forceTransition(UUID id, String fromState, String toState, OffsetDateTime now) {
        return update(() -> repository.forceTransition(id, fromState, toState, now)) > 0;
    }

    @Override
    public int clearExpiredLeases(OffsetDateTime now) {
        return update(() -> repository.clearExpiredLeases(now));
    }

    @Override
    public Map<String, Long> countReadyByType() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (StatorRecordRepository.ReadyCount row : repository.countReadyByEntityType()) {
            counts.put(row.getEntityType(), row.getReadyCount() == null ? 0L : row.getReadyCount());
        }
        return counts;
    }

    private int update(UpdateStatement statement) {
        Integer affected = transactionTemplate.execute(status -> statement.execute());
        return affected == null ? 0 : affected;
    }

    @FunctionalInterface
    private interface UpdateStatement {
        int execute();
    }
}
