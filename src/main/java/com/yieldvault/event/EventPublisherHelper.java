package com.yieldvault.event;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods for
 * vault and allocator events.
 *
 * <p>Events are delivered synchronously to {@code @EventListener}s. They are notifications
 * only: publishing happens after the state change has been applied, and a failed operation
 * publishes nothing except a {@link VaultEventType#SLIPPAGE_REJECTED} notice.
 *
 * <p>An operation that spans several components (an allocator dispatch paying into the local
 * vault) wraps itself in {@link #publishOnSuccess}, so events of steps that are later rolled
 * back are never delivered.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final ThreadLocal<List<ApplicationEvent>> heldBack = new ThreadLocal<>();

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Runs {@code action} holding back every event published on this thread meanwhile. The
     * events are delivered in order once it returns and dropped if it throws. A nested call
     * joins the outer batch.
     */
    public <T> T publishOnSuccess(Supplier<T> action) {
        if (heldBack.get() != null) {
            return action.get();
        }
        List<ApplicationEvent> batch = new ArrayList<>();
        heldBack.set(batch);
        T result;
        try {
            result = action.get();
        } finally {
            heldBack.remove();
        }
        batch.forEach(applicationEventPublisher::publishEvent);
        return result;
    }

    private void publish(ApplicationEvent event) {
        List<ApplicationEvent> batch = heldBack.get();
        if (batch != null) {
            batch.add(event);
        } else {
            applicationEventPublisher.publishEvent(event);
        }
    }

    // ---- Vault ----

    public void publishVault(Object source, VaultEventType eventType, Map<String, Object> details) {
        publish(new VaultEvent(source, eventType, details));
    }

    public void publishSharePriceUpdated(Object source, BigInteger previous, BigInteger current) {
        if (previous != null && previous.equals(current)) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous", previous);
        details.put("current", current);
        publishVault(source, VaultEventType.SHARE_PRICE_UPDATED, details);
    }

    // ---- Allocator ----

    public void publishAllocator(
            Object source, AllocatorEventType eventType, String strategyName, Map<String, Object> details) {
        publish(new AllocatorEvent(source, eventType, strategyName, details));
    }

    public void publishChainDebtUpdate(Object source, BigInteger previous, BigInteger current) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous", previous);
        details.put("current", current);
        publishAllocator(source, AllocatorEventType.CHAIN_DEBT_UPDATE, null, details);
    }

    public void publishLosses(Object source, String strategyName, BigInteger expected, BigInteger recovered) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected", expected);
        details.put("recovered", recovered);
        details.put("loss", expected.subtract(recovered));
        publishAllocator(source, AllocatorEventType.LOSSES, strategyName, details);
    }
}
