package com.yieldvault.event;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the ledger, fee engine, request queue and allocation engine after every
 * state change.
 *
 * <p>The details map carries the values an off-chain reconciler needs, typically the amounts
 * moved and the resulting share price, for example:
 * <ul>
 *   <li>DEPOSIT: {"caller", "receiver", "assets", "shares", "sharePrice"}</li>
 *   <li>SHARE_PRICE_UPDATED: {"previous", "current"}</li>
 *   <li>INVEST / LIQUIDATE: {"amounts", "totalAssetsBefore", "totalAssetsAfter"}</li>
 * </ul>
 *
 * <p>Key listeners: AccountingEventJournal (persistence), CustomMetricsService (counters).
 */
public class VaultEvent extends ApplicationEvent {

    private final VaultEventType eventType;
    private final Map<String, Object> details;

    public VaultEvent(Object source, VaultEventType eventType, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public VaultEventType getEventType() {
        return eventType;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
