package com.yieldvault.request;

import static com.yieldvault.ledger.VaultChecks.requireAddress;
import static com.yieldvault.ledger.VaultChecks.requirePositive;

import com.yieldvault.allocation.InputRegistry;
import com.yieldvault.core.guard.ReentrancyGuard;
import com.yieldvault.core.guard.Revertible;
import com.yieldvault.core.guard.StateRollback;
import com.yieldvault.domain.enums.RequestStatus;
import com.yieldvault.domain.enums.RequestType;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.domain.model.PendingRequest;
import com.yieldvault.domain.model.VaultState;
import com.yieldvault.event.EventPublisherHelper;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.ledger.ShareLedger;
import com.yieldvault.ledger.VaultAccounting;
import com.yieldvault.ledger.VaultChecks;
import com.yieldvault.ledger.VaultParameters;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Asynchronous deposit and redeem requests, one active request per operator.
 *
 * <p>Lifecycle of a request:
 * <ul>
 *   <li><b>request</b>: assets (deposit) or shares (redeem) are taken into escrow; status PENDING</li>
 *   <li><b>cancel</b>: allowed while PENDING, returns the escrow; the request is removed</li>
 *   <li><b>settle</b>: triggered by the vault operator, never by the requester. Deposits mint
 *       shares at the current price into escrow; redemptions burn their escrowed shares and
 *       reserve the assets, as far as available liquidity allows; status CLAIMABLE</li>
 *   <li><b>claim</b>: releases the escrowed shares or reserved assets; the request is removed</li>
 * </ul>
 *
 * <p>Escrowed deposit assets and reserved redemption assets are excluded from
 * {@code available}, so they never take part in allocation or in the share price.
 */
@Service
public class RequestQueue implements Revertible {

    private static final Logger log = LoggerFactory.getLogger(RequestQueue.class);

    private final VaultAccounting accounting;
    private final VaultState state;
    private final VaultParameters vaultParameters;
    private final ShareLedger shareLedger;
    private final InputRegistry inputRegistry;
    private final PriceOracle priceOracle;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    // Insertion order is settlement order
    private LinkedHashMap<String, PendingRequest> requests = new LinkedHashMap<>();

    public RequestQueue(
            VaultAccounting accounting,
            ShareLedger shareLedger,
            InputRegistry inputRegistry,
            PriceOracle priceOracle,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accounting = accounting;
        this.state = accounting.state();
        this.vaultParameters = accounting.parameters();
        this.shareLedger = shareLedger;
        this.inputRegistry = inputRegistry;
        this.priceOracle = priceOracle;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==============================
    // REQUEST
    // ==============================

    public PendingRequest requestDeposit(String operator, String owner, BigInteger assets) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("requestDeposit")) {
            return rollback("requestDeposit").run(() -> {
                checkAdmission(operator, owner, assets);
                checkCap(operator, assets);

                accounting.receiveAssets(assets);
                state.setPendingDepositAssets(state.getPendingDepositAssets().add(assets));
                PendingRequest request = store(RequestType.DEPOSIT, operator, owner, assets);

                log.info("Deposit request: operator={}, owner={}, assets={}", operator, owner, assets);
                publish(VaultEventType.DEPOSIT_REQUEST, request, Map.of("totalDepositRequest", totalDepositRequest()));
                return request;
            });
        }
    }

    /** Moves {@code shares} of {@code owner} into escrow. An operator other than the owner spends its allowance. */
    public PendingRequest requestRedeem(String operator, String owner, BigInteger shares) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("requestRedeem")) {
            return rollback("requestRedeem").run(() -> {
                checkAdmission(operator, owner, shares);

                accounting.spendAllowance(owner, operator, shares);
                accounting.escrowShares(owner, shares);
                PendingRequest request = store(RequestType.REDEEM, operator, owner, shares);

                log.info("Redeem request: operator={}, owner={}, shares={}", operator, owner, shares);
                publish(
                        VaultEventType.REDEEM_REQUEST,
                        request,
                        Map.of("totalRedemptionRequest", totalRedemptionRequest()));
                return request;
            });
        }
    }

    /**
     * Redemption request sized in assets: escrows the shares {@link ShareLedger#previewWithdraw} prices
     * {@code assets} at now, exit fee included. The request is then settled like any redeem request.
     */
    public PendingRequest requestWithdraw(String operator, String owner, BigInteger assets) {
        requirePositive(assets, "assets");
        return requestRedeem(operator, owner, shareLedger.previewWithdraw(assets));
    }

    // ==============================
    // CANCEL
    // ==============================

    /** Returns the escrowed assets of a pending deposit request to its owner. */
    public BigInteger cancelDepositRequest(String operator) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("cancelDepositRequest")) {
            return rollback("cancelDepositRequest").run(() -> {
                PendingRequest request = requirePending(operator, RequestType.DEPOSIT);
                state.setPendingDepositAssets(state.getPendingDepositAssets().subtract(request.getAmount()));
                accounting.sendAssets(request.getAmount());
                requests.remove(key(operator));

                log.info("Deposit request canceled: operator={}, assets={}", operator, request.getAmount());
                publish(VaultEventType.DEPOSIT_REQUEST_CANCELED, request, Map.of());
                return request.getAmount();
            });
        }
    }

    /** Returns the escrowed shares of a pending redeem request to its owner. */
    public BigInteger cancelRedeemRequest(String operator) {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("cancelRedeemRequest")) {
            return rollback("cancelRedeemRequest").run(() -> {
                PendingRequest request = requirePending(operator, RequestType.REDEEM);
                accounting.releaseEscrowedShares(request.getOwner(), request.getAmount());
                requests.remove(key(operator));

                log.info("Redeem request canceled: operator={}, shares={}", operator, request.getAmount());
                publish(VaultEventType.REDEEM_REQUEST_CANCELED, request, Map.of());
                return request.getAmount();
            });
        }
    }

    // ==============================
    // SETTLE
    // ==============================

    /**
     * Settles every pending deposit at the current share price. The entry fee is taken from the
     * escrowed assets; the rest joins {@code available}. Returns the number of requests settled.
     */
    public int settleDeposits() {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("settleDeposits")) {
            return rollback("settleDeposits").run(() -> {
                requireActive();
                int settled = 0;
                for (PendingRequest request : pendingOf(RequestType.DEPOSIT)) {
                    BigInteger assets = request.getAmount();
                    BigInteger fee = shareLedger.entryFee(assets);
                    BigInteger shares = accounting.convertToShares(assets.subtract(fee), RoundingMode.DOWN);

                    state.setPendingDepositAssets(state.getPendingDepositAssets().subtract(assets));
                    accounting.accrueTransactionFee(fee);
                    accounting.mintToEscrow(shares);
                    accounting.shiftCheckpoint(assets.subtract(fee));
                    PendingRequest claimable = markClaimable(request, shares);

                    log.info(
                            "Deposit request settled: operator={}, assets={}, fee={}, shares={}",
                            request.getOperator(),
                            assets,
                            fee,
                            shares);
                    publish(VaultEventType.REQUEST_SETTLED, claimable, Map.of("fee", fee));
                    settled++;
                }
                return settled;
            });
        }
    }

    /**
     * Settles pending redemptions in request order while their gross asset value fits in
     * {@code available}; stops at the first one that does not. Requests made before an asset
     * migration are left pending. Returns the number of requests settled.
     */
    public int settleRedemptions() {
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("settleRedemptions")) {
            return rollback("settleRedemptions").run(() -> {
                requireActive();
                int settled = 0;
                for (PendingRequest request : pendingOf(RequestType.REDEEM)) {
                    if (!request.getAsset().equalsIgnoreCase(state.getAsset())) {
                        log.debug("Redeem request of {} skipped: made against {}", request.getOperator(), request.getAsset());
                        continue;
                    }
                    BigInteger gross = accounting.convertToAssets(request.getAmount(), RoundingMode.DOWN);
                    if (gross.compareTo(accounting.available()) > 0) {
                        log.info(
                                "Redemption settlement stopped at {}: needs {}, available {}",
                                request.getOperator(),
                                gross,
                                accounting.available());
                        break;
                    }
                    BigInteger fee = shareLedger.exitFee(gross);
                    BigInteger net = gross.subtract(fee);

                    accounting.burnEscrowedShares(request.getAmount());
                    state.setClaimableRedemptionAssets(state.getClaimableRedemptionAssets().add(net));
                    accounting.accrueTransactionFee(fee);
                    accounting.shiftCheckpoint(gross.negate());
                    PendingRequest claimable = markClaimable(request, net);

                    log.info(
                            "Redeem request settled: operator={}, shares={}, assets={}, fee={}",
                            request.getOperator(),
                            request.getAmount(),
                            net,
                            fee);
                    publish(VaultEventType.REQUEST_SETTLED, claimable, Map.of("fee", fee));
                    settled++;
                }
                return settled;
            });
        }
    }

    // ==============================
    // CLAIM
    // ==============================

    /** Delivers the shares of a settled deposit to {@code receiver}. */
    public BigInteger claimDeposit(String operator, String receiver, Instant deadline) {
        VaultChecks.checkDeadline(clock, deadline);
        requireAddress(receiver, "receiver");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("claimDeposit")) {
            return rollback("claimDeposit").run(() -> {
                PendingRequest request = requireClaimTarget(operator, RequestType.DEPOSIT);
                if (request.isPending()) {
                    throw new VaultException(
                            ErrorCode.WRONG_REQUEST,
                            "Deposit request of " + operator + " is not settled yet",
                            Map.of("operator", operator));
                }
                accounting.releaseEscrowedShares(receiver, request.getClaimableAmount());
                requests.remove(key(operator));

                log.info(
                        "Deposit claimed: operator={}, receiver={}, shares={}",
                        operator,
                        receiver,
                        request.getClaimableAmount());
                publish(VaultEventType.REQUEST_CLAIMED, request, Map.of("receiver", receiver));
                return request.getClaimableAmount();
            });
        }
    }

    /** Pays the reserved assets of a settled redemption to {@code receiver}. */
    public BigInteger claimRedeem(String operator, String receiver, Instant deadline) {
        VaultChecks.checkDeadline(clock, deadline);
        requireAddress(receiver, "receiver");
        try (ReentrancyGuard.Scope ignored = accounting.guard().enter("claimRedeem")) {
            return rollback("claimRedeem").run(() -> {
                PendingRequest request = requireClaimTarget(operator, RequestType.REDEEM);
                if (request.isPending()) {
                    BigInteger needed = accounting.convertToAssets(request.getAmount(), RoundingMode.DOWN);
                    throw new VaultException(
                            ErrorCode.INSUFFICIENT_FUNDS,
                            "Redemption of " + operator + " is not settled; liquidity must be freed first",
                            Map.of("operator", operator, "assetsNeeded", needed, "available", accounting.available()));
                }
                BigInteger assets = request.getClaimableAmount();
                state.setClaimableRedemptionAssets(state.getClaimableRedemptionAssets().subtract(assets));
                accounting.sendAssets(assets);
                requests.remove(key(operator));

                log.info("Redemption claimed: operator={}, receiver={}, assets={}", operator, receiver, assets);
                publish(VaultEventType.REQUEST_CLAIMED, request, Map.of("receiver", receiver));
                return assets;
            });
        }
    }

    // ==============================
    // QUERIES
    // ==============================

    public Optional<PendingRequest> pendingRequest(String operator) {
        return Optional.ofNullable(requests.get(key(operator)));
    }

    public List<PendingRequest> requests() {
        return List.copyOf(requests.values());
    }

    /** Assets escrowed by unsettled deposit requests. */
    public BigInteger totalDepositRequest() {
        return state.getPendingDepositAssets();
    }

    /** Shares escrowed by unsettled redeem requests. */
    public BigInteger totalRedemptionRequest() {
        BigInteger total = BigInteger.ZERO;
        for (PendingRequest request : pendingOf(RequestType.REDEEM)) {
            total = total.add(request.getAmount());
        }
        return total;
    }

    /** Gross asset value of {@link #totalRedemptionRequest()} at the current price. */
    public BigInteger totalRedemptionRequestAssets() {
        return accounting.convertToAssets(totalRedemptionRequest(), RoundingMode.DOWN);
    }

    public BigInteger totalClaimableRedemption() {
        return state.getClaimableRedemptionAssets();
    }

    @Override
    public Runnable checkpoint() {
        LinkedHashMap<String, PendingRequest> snapshot = new LinkedHashMap<>(requests);
        return () -> requests = snapshot;
    }

    // ==============================
    // HELPERS
    // ==============================

    private StateRollback rollback(String operation) {
        return StateRollback.begin(operation, state, this);
    }

    private void checkAdmission(String operator, String owner, BigInteger amount) {
        requireActive();
        requirePositive(amount, "amount");
        requireAddress(operator, "operator");
        requireAddress(owner, "owner");
        if (requests.containsKey(key(operator))) {
            throw new VaultException(
                    ErrorCode.WRONG_REQUEST,
                    "Operator " + operator + " already has an active request",
                    Map.of("operator", operator, "existing", requests.get(key(operator)).getType()));
        }
        requireOracles();
    }

    /** The asset and every non-asset input need a feed before any request is admitted. */
    private void requireOracles() {
        List<String> tokens = new ArrayList<>();
        tokens.add(state.getAsset());
        for (InputSlot slot : inputRegistry.activeSlots()) {
            if (!slot.getToken().equalsIgnoreCase(state.getAsset())) {
                tokens.add(slot.getToken());
            }
        }
        for (String token : tokens) {
            if (!priceOracle.hasFeed(token)) {
                throw new VaultException(ErrorCode.MISSING_ORACLE, "No price feed for " + token, Map.of("token", token));
            }
        }
    }

    private void checkCap(String operator, BigInteger assets) {
        if (vaultParameters.isCapExempt(operator)) {
            return;
        }
        BigInteger after = accounting.totalAssets().add(state.getPendingDepositAssets()).add(assets);
        if (after.compareTo(state.getMaxTotalAssets()) > 0) {
            throw new VaultException(
                    ErrorCode.MAX_DEPOSIT_REACHED,
                    "Deposit request would take total assets to " + after + ", above " + state.getMaxTotalAssets(),
                    Map.of("totalAfter", after, "maxTotalAssets", state.getMaxTotalAssets()));
        }
    }

    private void requireActive() {
        if (state.isPaused()) {
            throw new VaultException(ErrorCode.PAUSED, "Vault is paused");
        }
    }

    private PendingRequest requirePending(String operator, RequestType type) {
        requireAddress(operator, "operator");
        PendingRequest request = requests.get(key(operator));
        if (request == null || request.getType() != type) {
            throw new VaultException(
                    ErrorCode.WRONG_REQUEST, "No " + type.name().toLowerCase() + " request for " + operator);
        }
        if (!request.isPending()) {
            throw new VaultException(
                    ErrorCode.WRONG_REQUEST,
                    "Request of " + operator + " is already settled and can only be claimed",
                    Map.of("operator", operator, "status", request.getStatus()));
        }
        return request;
    }

    private PendingRequest requireClaimTarget(String operator, RequestType type) {
        requireAddress(operator, "operator");
        PendingRequest request = requests.get(key(operator));
        if (request == null || request.getType() != type) {
            throw new VaultException(
                    ErrorCode.WRONG_REQUEST, "No " + type.name().toLowerCase() + " request for " + operator);
        }
        if (!request.getAsset().equalsIgnoreCase(state.getAsset())) {
            throw new VaultException(
                    ErrorCode.WRONG_TOKEN,
                    "Request was made against " + request.getAsset() + ", vault asset is now " + state.getAsset(),
                    Map.of("requestAsset", request.getAsset(), "vaultAsset", state.getAsset()));
        }
        return request;
    }

    private PendingRequest store(RequestType type, String operator, String owner, BigInteger amount) {
        PendingRequest request = PendingRequest.builder()
                .type(type)
                .status(RequestStatus.PENDING)
                .operator(operator)
                .owner(owner)
                .amount(amount)
                .claimableAmount(BigInteger.ZERO)
                .asset(state.getAsset())
                .requestTimestamp(clock.instant())
                .build();
        requests.put(key(operator), request);
        return request;
    }

    private PendingRequest markClaimable(PendingRequest request, BigInteger claimableAmount) {
        PendingRequest claimable = request.toBuilder()
                .status(RequestStatus.CLAIMABLE)
                .claimableAmount(claimableAmount)
                .settledAt(clock.instant())
                .build();
        requests.put(key(request.getOperator()), claimable);
        return claimable;
    }

    private List<PendingRequest> pendingOf(RequestType type) {
        List<PendingRequest> pending = new ArrayList<>();
        for (PendingRequest request : requests.values()) {
            if (request.getType() == type && request.isPending()) {
                pending.add(request);
            }
        }
        return pending;
    }

    private void publish(VaultEventType type, PendingRequest request, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operator", request.getOperator());
        details.put("owner", request.getOwner());
        details.put("requestType", request.getType().name());
        details.put("amount", request.getAmount());
        details.put("claimableAmount", request.getClaimableAmount());
        details.put("asset", request.getAsset());
        details.putAll(extra);
        eventPublisherHelper.publishVault(this, type, details);
    }

    private static String key(String operator) {
        return operator.toLowerCase();
    }
}
