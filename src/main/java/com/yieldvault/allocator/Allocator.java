package com.yieldvault.allocator;

import static com.yieldvault.ledger.VaultChecks.requireAddress;
import static com.yieldvault.ledger.VaultChecks.requireNonNegative;
import static com.yieldvault.ledger.VaultChecks.requirePositive;

import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.core.guard.Revertible;
import com.yieldvault.core.guard.StateRollback;
import com.yieldvault.domain.model.StrategyMapEntry;
import com.yieldvault.domain.model.StrategyRecord;
import com.yieldvault.event.AllocatorEventType;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.ResourceNotFoundException;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.StrategyEntryPoint;
import com.yieldvault.mapper.StrategyMapMapper;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates capital from a shared pool (the crate) across many strategies.
 *
 * <p>Each strategy is an opaque debtor: the allocator tracks its own {@code debt} per strategy
 * and never reads the strategy's internal accounting, except for the informational
 * {@code totalAssetsAvailable} of {@link #strategyMap()}. {@code totalChainDebt} is always the
 * sum of the strategies' debts.
 *
 * <p>Eligibility for new capital:
 * <ul>
 *   <li>the strategy is whitelisted and not panicked</li>
 *   <li>its debt after the dispatch does not exceed {@code maxDeposit}</li>
 * </ul>
 *
 * <p>The panicked flag is sticky. It is set by {@link #panicLiquidateStrategy} or by an admin and
 * only an explicit {@link #setPanicked} call clears it.
 *
 * <p>The allocator has its own guard and rollback. Dispatch and recall also roll back every
 * revertible entry point, the local vault included, and deliver their events only once the
 * whole call has succeeded.
 */
@Service
public class Allocator implements Revertible {

    private static final Logger log = LoggerFactory.getLogger(Allocator.class);

    private final EventPublisherHelper eventPublisherHelper;
    private final StrategyMapMapper strategyMapMapper = Mappers.getMapper(StrategyMapMapper.class);
    private final ReentrancyGuard guard = new ReentrancyGuard("allocator");

    /** Entry points this instance can reach, by address. */
    private final Map<String, StrategyEntryPoint> knownEntryPoints = new HashMap<>();

    private LinkedHashMap<String, StrategyRecord> strategies = new LinkedHashMap<>();
    private BigInteger crate = BigInteger.ZERO;

    public Allocator(List<StrategyEntryPoint> entryPoints, EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
        for (StrategyEntryPoint entryPoint : entryPoints) {
            knownEntryPoints.put(entryPoint.address().toLowerCase(), entryPoint);
        }
    }

    // ==============================
    // CRATE
    // ==============================

    public void fundCrate(BigInteger amount) {
        requirePositive(amount, "amount");
        try (ReentrancyGuard.Scope ignored = guard.enter("fundCrate")) {
            crate = crate.add(amount);
            log.info("Crate funded with {}, balance {}", amount, crate);
        }
    }

    /** Sends idle crate capital to {@code receiver}. Committed capital (debt) is not touched. */
    public void withdrawFromCrate(BigInteger amount, String receiver) {
        requirePositive(amount, "amount");
        requireAddress(receiver, "receiver");
        try (ReentrancyGuard.Scope ignored = guard.enter("withdrawFromCrate")) {
            if (amount.compareTo(crate) > 0) {
                throw new VaultException(
                        ErrorCode.INSUFFICIENT_FUNDS,
                        "Crate holds " + crate + ", cannot withdraw " + amount,
                        Map.of("crate", crate, "amount", amount));
            }
            crate = crate.subtract(amount);
            log.info("Crate withdrawal of {} to {}, balance {}", amount, receiver, crate);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("amount", amount);
            details.put("receiver", receiver);
            details.put("crate", crate);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.WITHDRAW, null, details);
        }
    }

    // ==============================
    // REGISTRY
    // ==============================

    public StrategyRecord addStrategy(String name, String entryPointAddress, BigInteger maxDeposit) {
        StrategyEntryPoint entryPoint = resolveEntryPoint(entryPointAddress);
        return addStrategy(name, entryPoint, maxDeposit);
    }

    public StrategyRecord addStrategy(String name, StrategyEntryPoint entryPoint, BigInteger maxDeposit) {
        if (name == null || name.isBlank()) {
            throw new VaultException(ErrorCode.VALIDATION_ERROR, "Strategy name is required");
        }
        requireAddress(entryPoint.address(), "entry point");
        requireNonNegative(maxDeposit, "maxDeposit");
        try (ReentrancyGuard.Scope ignored = guard.enter("addStrategy")) {
            if (strategies.containsKey(name)) {
                throw new VaultException(
                        ErrorCode.WRONG_REQUEST, "Strategy " + name + " already exists", Map.of("strategy", name));
            }
            StrategyRecord record = StrategyRecord.builder()
                    .name(name)
                    .entryPoint(entryPoint)
                    .maxDeposit(maxDeposit)
                    .debt(BigInteger.ZERO)
                    .whitelisted(true)
                    .panicked(false)
                    .lastReportedAssets(BigInteger.ZERO)
                    .build();
            strategies.put(name, record);
            knownEntryPoints.putIfAbsent(entryPoint.address().toLowerCase(), entryPoint);

            log.info("Strategy added: name={}, entryPoint={}, maxDeposit={}", name, entryPoint.address(), maxDeposit);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("entryPoint", entryPoint.address());
            details.put("maxDeposit", maxDeposit);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.STRATEGY_ADDED, name, details);
            return record.copy();
        }
    }

    /** A ceiling below the current debt is refused unless the strategy is panicked. */
    public void setMaxDeposit(String name, BigInteger maxDeposit) {
        requireNonNegative(maxDeposit, "maxDeposit");
        try (ReentrancyGuard.Scope ignored = guard.enter("setMaxDeposit")) {
            StrategyRecord record = require(name);
            if (!record.isPanicked() && maxDeposit.compareTo(record.getDebt()) < 0) {
                throw new VaultException(
                        ErrorCode.AMOUNT_TOO_LOW,
                        "Max deposit " + maxDeposit + " of " + name + " is below its debt " + record.getDebt(),
                        Map.of("strategy", name, "maxDeposit", maxDeposit, "debt", record.getDebt()));
            }
            BigInteger previous = record.getMaxDeposit();
            record.setMaxDeposit(maxDeposit);

            log.info("Max deposit of {} changed: {} -> {}", name, previous, maxDeposit);
            eventPublisherHelper.publishAllocator(
                    this, AllocatorEventType.MAX_DEPOSIT_UPDATED, name, beforeAfter(previous, maxDeposit));
        }
    }

    public void setWhitelisted(String name, boolean whitelisted) {
        try (ReentrancyGuard.Scope ignored = guard.enter("setWhitelisted")) {
            StrategyRecord record = require(name);
            boolean previous = record.isWhitelisted();
            record.setWhitelisted(whitelisted);

            log.info("Strategy {} whitelisted: {} -> {}", name, previous, whitelisted);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", "whitelisted");
            details.put("previous", previous);
            details.put("current", whitelisted);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.STRATEGY_UPDATE, name, details);
        }
    }

    /**
     * Sets or clears the sticky panicked flag. Clearing it is the only way back to eligibility
     * and is refused while the debt is above {@code maxDeposit}.
     */
    public void setPanicked(String name, boolean panicked) {
        try (ReentrancyGuard.Scope ignored = guard.enter("setPanicked")) {
            StrategyRecord record = require(name);
            if (!panicked && record.getDebt().compareTo(record.getMaxDeposit()) > 0) {
                throw new VaultException(
                        ErrorCode.MAX_DEPOSIT_REACHED,
                        "Strategy " + name + " owes " + record.getDebt() + ", above " + record.getMaxDeposit(),
                        Map.of("strategy", name, "debt", record.getDebt(), "maxDeposit", record.getMaxDeposit()));
            }
            boolean previous = record.isPanicked();
            record.setPanicked(panicked);

            if (panicked) {
                log.warn("Strategy {} flagged as panicked", name);
            } else {
                log.info("Panicked flag of strategy {} cleared", name);
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("previous", previous);
            details.put("current", panicked);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.PANIC_SET, name, details);
        }
    }

    /** Removes a strategy whose debt has been fully recalled; CANT_UPDATE_CRATE otherwise. */
    public void retireStrategy(String name) {
        try (ReentrancyGuard.Scope ignored = guard.enter("retireStrategy")) {
            StrategyRecord record = require(name);
            if (record.getDebt().signum() != 0) {
                throw new VaultException(
                        ErrorCode.CANT_UPDATE_CRATE,
                        "Strategy " + name + " still owes " + record.getDebt(),
                        Map.of("strategy", name, "debt", record.getDebt()));
            }
            strategies.remove(name);

            log.info("Strategy {} retired", name);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field", "retired");
            details.put("current", true);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.STRATEGY_UPDATE, name, details);
        }
    }

    // ==============================
    // DISPATCH
    // ==============================

    /**
     * Sends {@code amounts[i]} of crate capital to {@code strategies[i]}, raising each debt.
     *
     * <p>All eligibility and ceiling checks run before any transfer, cumulatively for a strategy
     * that appears more than once. A failure leaves debts and the crate untouched.
     */
    public BigInteger dispatchAssets(List<BigInteger> amounts, List<String> names) {
        if (amounts == null || names == null || amounts.size() != names.size() || amounts.isEmpty()) {
            throw new VaultException(
                    ErrorCode.INCORRECT_ARRAY_LENGTHS,
                    "amounts and strategies must be non-empty and of equal length",
                    Map.of(
                            "amounts", amounts == null ? 0 : amounts.size(),
                            "strategies", names == null ? 0 : names.size()));
        }
        try (ReentrancyGuard.Scope ignored = guard.enter("dispatchAssets")) {
            validateDispatch(amounts, names);
            return atomically("dispatchAssets", () -> doDispatch(amounts, names));
        }
    }

    private void validateDispatch(List<BigInteger> amounts, List<String> names) {
        Map<String, BigInteger> projected = new HashMap<>();
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            BigInteger amount = amounts.get(i);
            StrategyRecord record = require(name);
            if (!record.isWhitelisted()) {
                throw new VaultException(ErrorCode.NOT_WHITELISTED, "Strategy " + name + " is not whitelisted");
            }
            if (record.isPanicked()) {
                throw new VaultException(ErrorCode.STRATEGY_PANICKED, "Strategy " + name + " is panicked");
            }
            requirePositive(amount, "amount for " + name);

            BigInteger debtAfter = projected.getOrDefault(name, record.getDebt()).add(amount);
            if (debtAfter.compareTo(record.getMaxDeposit()) > 0) {
                throw new VaultException(
                        ErrorCode.MAX_DEPOSIT_REACHED,
                        "Strategy " + name + " debt would reach " + debtAfter + ", above " + record.getMaxDeposit(),
                        Map.of("strategy", name, "debtAfter", debtAfter, "maxDeposit", record.getMaxDeposit()));
            }
            projected.put(name, debtAfter);
            total = total.add(amount);
        }
        if (total.compareTo(crate) > 0) {
            throw new VaultException(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    "Dispatch of " + total + " exceeds crate balance " + crate,
                    Map.of("total", total, "crate", crate));
        }
    }

    private BigInteger doDispatch(List<BigInteger> amounts, List<String> names) {
        BigInteger debtBefore = totalChainDebt();
        BigInteger total = BigInteger.ZERO;
        for (int i = 0; i < names.size(); i++) {
            StrategyRecord record = strategies.get(names.get(i));
            BigInteger amount = amounts.get(i);
            BigInteger previousDebt = record.getDebt();

            crate = crate.subtract(amount);
            record.getEntryPoint().deposit(amount);
            record.setDebt(previousDebt.add(amount));
            total = total.add(amount);

            log.info("Dispatched {} to {}: debt {} -> {}", amount, record.getName(), previousDebt, record.getDebt());
            Map<String, Object> details = beforeAfter(previousDebt, record.getDebt());
            details.put("amount", amount);
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.DEPOSIT_IN_STRATEGY, record.getName(), details);
        }
        eventPublisherHelper.publishChainDebtUpdate(this, debtBefore, totalChainDebt());
        return total;
    }

    // ==============================
    // LIQUIDATE
    // ==============================

    /**
     * Recalls {@code amount} from a strategy. Debt drops by {@code amount} whatever is recovered;
     * a shortfall is reported as a LOSSES event. Fails when less than {@code minAmountOut} comes back.
     */
    public BigInteger liquidateStrategy(BigInteger amount, BigInteger minAmountOut, String name) {
        requirePositive(amount, "amount");
        requireNonNegative(minAmountOut, "minAmountOut");
        try (ReentrancyGuard.Scope ignored = guard.enter("liquidateStrategy")) {
            return atomically("liquidateStrategy", () -> {
                StrategyRecord record = require(name);
                if (amount.compareTo(record.getDebt()) > 0) {
                    throw new VaultException(
                            ErrorCode.AMOUNT_TOO_HIGH,
                            "Cannot recall " + amount + " from " + name + ", debt is " + record.getDebt(),
                            Map.of("strategy", name, "amount", amount, "debt", record.getDebt()));
                }
                BigInteger recovered = record.getEntryPoint().withdraw(amount, minAmountOut);
                if (recovered.compareTo(minAmountOut) < 0) {
                    throw new VaultException(
                            ErrorCode.AMOUNT_TOO_LOW,
                            "Strategy " + name + " returned " + recovered + ", below " + minAmountOut,
                            Map.of("strategy", name, "recovered", recovered, "minAmountOut", minAmountOut));
                }
                return settleRecall(record, amount, recovered, AllocatorEventType.STRAT_POSITION_UPDATED);
            });
        }
    }

    /**
     * Unconditional exit: flags the strategy panicked and recalls its whole debt with no minimum
     * output. Debt is zeroed; any shortfall is reported as a loss.
     */
    public BigInteger panicLiquidateStrategy(String name) {
        try (ReentrancyGuard.Scope ignored = guard.enter("panicLiquidateStrategy")) {
            return atomically("panicLiquidateStrategy", () -> {
                StrategyRecord record = require(name);
                record.setPanicked(true);
                BigInteger debt = record.getDebt();
                BigInteger recovered = debt.signum() > 0 ? record.getEntryPoint().panicWithdraw(debt) : BigInteger.ZERO;

                log.error("Panic liquidation of {}: debt {}, recovered {}", name, debt, recovered);
                return settleRecall(record, debt, recovered, AllocatorEventType.PANIC_LIQUIDATE);
            });
        }
    }

    private BigInteger settleRecall(
            StrategyRecord record, BigInteger amount, BigInteger recovered, AllocatorEventType eventType) {
        BigInteger debtBefore = totalChainDebt();
        BigInteger previousDebt = record.getDebt();
        record.setDebt(previousDebt.subtract(amount));
        crate = crate.add(recovered);

        if (eventType != AllocatorEventType.PANIC_LIQUIDATE) {
            log.info(
                    "Recalled {} from {}: recovered {}, debt {} -> {}",
                    amount,
                    record.getName(),
                    recovered,
                    previousDebt,
                    record.getDebt());
        }
        if (recovered.compareTo(amount) < 0) {
            log.warn("Strategy {} returned {} for {} recalled", record.getName(), recovered, amount);
            eventPublisherHelper.publishLosses(this, record.getName(), amount, recovered);
        }
        Map<String, Object> details = beforeAfter(previousDebt, record.getDebt());
        details.put("amount", amount);
        details.put("recovered", recovered);
        eventPublisherHelper.publishAllocator(this, eventType, record.getName(), details);
        eventPublisherHelper.publishChainDebtUpdate(this, debtBefore, totalChainDebt());
        return recovered;
    }

    // ==============================
    // STRATEGY SELF-REPORT
    // ==============================

    /**
     * Debt update reported by a strategy itself, e.g. after compounding. The caller must be the
     * entry point of a registered strategy. Only bounds-checked against {@code maxDeposit},
     * which a panicked strategy may exceed.
     */
    public void updateStrategyDebt(String caller, BigInteger newDebt, BigInteger reportedAssets) {
        requireAddress(caller, "caller");
        requireNonNegative(newDebt, "newDebt");
        try (ReentrancyGuard.Scope ignored = guard.enter("updateStrategyDebt")) {
            StrategyRecord record = strategies.values().stream()
                    .filter(r -> r.getEntryPoint().address().equalsIgnoreCase(caller))
                    .findFirst()
                    .orElseThrow(() -> new VaultException(
                            ErrorCode.UNAUTHORIZED,
                            caller + " is not a registered strategy",
                            Map.of("caller", caller)));
            if (!record.isPanicked() && newDebt.compareTo(record.getMaxDeposit()) > 0) {
                throw new VaultException(
                        ErrorCode.MAX_DEPOSIT_REACHED,
                        "Reported debt " + newDebt + " of " + record.getName() + " exceeds " + record.getMaxDeposit(),
                        Map.of("strategy", record.getName(), "debt", newDebt, "maxDeposit", record.getMaxDeposit()));
            }

            BigInteger debtBefore = totalChainDebt();
            BigInteger previousDebt = record.getDebt();
            record.setDebt(newDebt);
            record.setLastReportedAssets(reportedAssets != null ? reportedAssets : BigInteger.ZERO);

            log.info("Strategy {} reported debt {} -> {} (assets {})", record.getName(), previousDebt, newDebt, reportedAssets);
            Map<String, Object> details = beforeAfter(previousDebt, newDebt);
            details.put("reportedAssets", record.getLastReportedAssets());
            eventPublisherHelper.publishAllocator(this, AllocatorEventType.STRAT_POSITION_UPDATED, record.getName(), details);
            eventPublisherHelper.publishChainDebtUpdate(this, debtBefore, totalChainDebt());
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    /** Read-only snapshot of every registered strategy. */
    public List<StrategyMapEntry> strategyMap() {
        List<StrategyMapEntry> entries = new ArrayList<>();
        for (StrategyRecord record : strategies.values()) {
            StrategyMapEntry entry = strategyMapMapper.toEntry(record);
            entry.setTotalAssetsAvailable(record.getEntryPoint().totalAssets());
            entries.add(entry);
        }
        return entries;
    }

    public Optional<StrategyRecord> strategy(String name) {
        return Optional.ofNullable(strategies.get(name)).map(StrategyRecord::copy);
    }

    public BigInteger totalChainDebt() {
        return strategies.values().stream().map(StrategyRecord::getDebt).reduce(BigInteger.ZERO, BigInteger::add);
    }

    public BigInteger crateBalance() {
        return crate;
    }

    @Override
    public Runnable checkpoint() {
        LinkedHashMap<String, StrategyRecord> snapshot = new LinkedHashMap<>();
        strategies.forEach((name, record) -> snapshot.put(name, record.copy()));
        BigInteger crateSnapshot = crate;
        return () -> {
            strategies = snapshot;
            crate = crateSnapshot;
        };
    }

    // ==============================
    // HELPERS
    // ==============================

    private <T> T atomically(String operation, Supplier<T> action) {
        return eventPublisherHelper.publishOnSuccess(() -> StateRollback.begin(operation, this)
                .trackAll(knownEntryPoints.values())
                .run(action));
    }

    private StrategyRecord require(String name) {
        StrategyRecord record = name == null ? null : strategies.get(name);
        if (record == null) {
            throw new ResourceNotFoundException("Strategy", String.valueOf(name));
        }
        return record;
    }

    private StrategyEntryPoint resolveEntryPoint(String address) {
        requireAddress(address, "entry point");
        StrategyEntryPoint entryPoint = knownEntryPoints.get(address.toLowerCase());
        if (entryPoint == null) {
            throw new ResourceNotFoundException("Strategy entry point", address);
        }
        return entryPoint;
    }

    private static Map<String, Object> beforeAfter(Object previous, Object current) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous", previous);
        details.put("current", current);
        return details;
    }
}
