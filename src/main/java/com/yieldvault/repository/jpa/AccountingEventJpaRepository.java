package com.yieldvault.repository.jpa;

import com.yieldvault.entity.AccountingEventEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the accounting_events table. Written by AccountingEventJournal, read by
 * the vault events endpoint.
 */
@Repository
public interface AccountingEventJpaRepository extends JpaRepository<AccountingEventEntity, Long> {

    List<AccountingEventEntity> findTop100ByOrderByIdDesc();

    List<AccountingEventEntity> findByEventTypeOrderByIdDesc(String eventType);

    List<AccountingEventEntity> findBySubjectOrderByIdDesc(String subject);

    @Query("SELECT e FROM AccountingEventEntity e WHERE e.timestamp BETWEEN :from AND :to ORDER BY e.id DESC")
    List<AccountingEventEntity> findByDateRange(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);
}
