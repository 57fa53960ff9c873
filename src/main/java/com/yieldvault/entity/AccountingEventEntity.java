package com.yieldvault.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the accounting_events table.
 *
 * <p>Append-only journal of every vault and allocator boundary event. The details map is
 * stored as JSON text; amounts inside it are exact integers (wei).
 */
@Entity
@Table(
        name = "accounting_events",
        indexes = {
            @Index(name = "idx_accounting_events_type", columnList = "event_type"),
            @Index(name = "idx_accounting_events_subject", columnList = "subject")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountingEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "category", nullable = false, length = 20)
    private String category;

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    /** Strategy name for strategy-level allocator events. */
    @Column(name = "subject", length = 100)
    private String subject;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;
}
