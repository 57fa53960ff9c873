package com.yieldvault.domain.model;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One vault or allocator event as journaled for off-chain reconciliation.
 *
 * <p>{@code category} is VAULT or ALLOCATOR; {@code subject} is the strategy name for
 * allocator events about one strategy, null otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountingEventRecord {

    private Long id;
    private LocalDateTime timestamp;
    private String category;
    private String eventType;
    private String subject;
    private Map<String, Object> details;
}
