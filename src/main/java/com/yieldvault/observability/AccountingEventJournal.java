package com.yieldvault.observability;

import com.yieldvault.domain.model.AccountingEventRecord;
import com.yieldvault.entity.AccountingEventEntity;
import com.yieldvault.event.AllocatorEvent;
import com.yieldvault.event.VaultEvent;
import com.yieldvault.mapper.AccountingEventMapper;
import com.yieldvault.repository.jpa.AccountingEventJpaRepository;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Write-behind journal of vault and allocator events in H2.
 *
 * <p>Every {@link VaultEvent} and {@link AllocatorEvent} is queued as an
 * {@link AccountingEventRecord} and flushed in batches on a fixed schedule, so accounting
 * calls never wait on database I/O. The journal is what an off-chain indexer would rebuild
 * share price and chain debt history from.
 *
 * <p>Circuit breaker: after {@value #FAILURE_THRESHOLD} consecutive persistence failures the
 * circuit opens and flushes are skipped until {@value #RECOVERY_INTERVAL_MS}ms have passed.
 * A failed batch goes back to the head of the queue, so records are never dropped and keep
 * the order the events happened in.
 */
@Service
public class AccountingEventJournal {

    private static final Logger log = LoggerFactory.getLogger(AccountingEventJournal.class);

    static final int FAILURE_THRESHOLD = 3;
    static final long RECOVERY_INTERVAL_MS = 60_000;
    private static final int MAX_BATCH_SIZE = 200;

    public static final String CATEGORY_VAULT = "VAULT";
    public static final String CATEGORY_ALLOCATOR = "ALLOCATOR";

    private final AccountingEventJpaRepository accountingEventJpaRepository;
    private final Clock clock;
    private final AccountingEventMapper accountingEventMapper = Mappers.getMapper(AccountingEventMapper.class);

    private final ConcurrentLinkedDeque<AccountingEventRecord> pendingQueue = new ConcurrentLinkedDeque<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicBoolean circuitOpen = new AtomicBoolean(false);
    private volatile long circuitOpenedAt = 0;

    public AccountingEventJournal(AccountingEventJpaRepository accountingEventJpaRepository, Clock clock) {
        this.accountingEventJpaRepository = accountingEventJpaRepository;
        this.clock = clock;
    }

    // ==============================
    // LISTENERS
    // ==============================

    @EventListener
    @Order(30)
    public void onVaultEvent(VaultEvent event) {
        queue(CATEGORY_VAULT, event.getEventType().name(), null, event.getDetails());
    }

    @EventListener
    @Order(30)
    public void onAllocatorEvent(AllocatorEvent event) {
        queue(CATEGORY_ALLOCATOR, event.getEventType().name(), event.getStrategyName(), event.getDetails());
    }

    private void queue(String category, String eventType, String subject, Map<String, Object> details) {
        pendingQueue.add(AccountingEventRecord.builder()
                .timestamp(LocalDateTime.now(clock))
                .category(category)
                .eventType(eventType)
                .subject(subject)
                .details(details != null ? new LinkedHashMap<>(details) : null)
                .build());
    }

    // ==============================
    // FLUSH
    // ==============================

    /** Flushes up to one batch of queued records. Skipped while the circuit is open. */
    @Scheduled(fixedRateString = "${yieldvault.journal.flush-interval-ms:2000}")
    public void flush() {
        if (pendingQueue.isEmpty()) {
            return;
        }

        if (circuitOpen.get()) {
            if (clock.millis() - circuitOpenedAt < RECOVERY_INTERVAL_MS) {
                log.debug("Circuit open, skipping flush. {} records queued.", pendingQueue.size());
                return;
            }
            log.info("Circuit breaker recovery attempt. {} records queued.", pendingQueue.size());
        }

        List<AccountingEventRecord> batch = new ArrayList<>(MAX_BATCH_SIZE);
        for (int i = 0; i < MAX_BATCH_SIZE; i++) {
            AccountingEventRecord eventRecord = pendingQueue.poll();
            if (eventRecord == null) {
                break;
            }
            batch.add(eventRecord);
        }

        try {
            List<AccountingEventEntity> entities = accountingEventMapper.toEntityList(batch);
            accountingEventJpaRepository.saveAll(entities);

            if (circuitOpen.compareAndSet(true, false)) {
                log.info("Circuit breaker closed after successful flush");
            }
            consecutiveFailures.set(0);
            log.debug("Flushed {} accounting events to H2", batch.size());

        } catch (RuntimeException e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.error(
                    "Failed to persist {} accounting events (failure {}/{}): {}",
                    batch.size(),
                    failures,
                    FAILURE_THRESHOLD,
                    e.getMessage());

            if (failures >= FAILURE_THRESHOLD && circuitOpen.compareAndSet(false, true)) {
                circuitOpenedAt = clock.millis();
                log.warn(
                        "Circuit breaker opened after {} consecutive failures. Will retry after {}ms. {} records in queue.",
                        failures,
                        RECOVERY_INTERVAL_MS,
                        pendingQueue.size());
            }

            requeueAtHead(batch);
        }
    }

    private void requeueAtHead(List<AccountingEventRecord> batch) {
        ListIterator<AccountingEventRecord> it = batch.listIterator(batch.size());
        while (it.hasPrevious()) {
            pendingQueue.offerFirst(it.previous());
        }
    }

    /** Drains the queue on shutdown, bypassing the circuit breaker. */
    @PreDestroy
    public void forceFlush() {
        if (pendingQueue.isEmpty()) {
            return;
        }
        log.info("Force flushing {} pending accounting events", pendingQueue.size());
        resetCircuitBreaker();
        int rounds = pendingQueue.size() / MAX_BATCH_SIZE + 1;
        for (int i = 0; i < rounds && !pendingQueue.isEmpty() && !circuitOpen.get(); i++) {
            flush();
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    public List<AccountingEventRecord> recent() {
        return accountingEventMapper.toDomainList(accountingEventJpaRepository.findTop100ByOrderByIdDesc());
    }

    public List<AccountingEventRecord> byEventType(String eventType) {
        return accountingEventMapper.toDomainList(accountingEventJpaRepository.findByEventTypeOrderByIdDesc(eventType));
    }

    public List<AccountingEventRecord> bySubject(String subject) {
        return accountingEventMapper.toDomainList(accountingEventJpaRepository.findBySubjectOrderByIdDesc(subject));
    }

    // ---- Circuit breaker state (for monitoring) ----

    public boolean isCircuitOpen() {
        return circuitOpen.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int getPendingCount() {
        return pendingQueue.size();
    }

    public void resetCircuitBreaker() {
        circuitOpen.set(false);
        consecutiveFailures.set(0);
        log.info("Circuit breaker manually reset");
    }
}
