package com.yieldvault.api.controller;

import com.yieldvault.api.dto.request.AmountRequest;
import com.yieldvault.api.dto.request.FeesRequest;
import com.yieldvault.api.dto.request.ShareTransferRequest;
import com.yieldvault.api.dto.request.SwapDepositRequest;
import com.yieldvault.api.dto.request.UpdateAssetRequest;
import com.yieldvault.api.dto.request.VaultOperationRequest;
import com.yieldvault.api.dto.response.VaultStateResponse;
import com.yieldvault.domain.model.AccountingEventRecord;
import com.yieldvault.domain.model.FeeCollectionResult;
import com.yieldvault.domain.model.Fees;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.FeeAccrualEngine;
import com.yieldvault.ledger.ShareLedger;
import com.yieldvault.ledger.VaultAccounting;
import com.yieldvault.observability.AccountingEventJournal;
import com.yieldvault.service.VaultService;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the share ledger: synchronous deposits and withdrawals, share transfers,
 * fees and vault configuration.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/vault} -- vault snapshot</li>
 *   <li>{@code GET /api/vault/accounts/{address}} -- shares and asset value of an account</li>
 *   <li>{@code GET /api/vault/preview} -- previewDeposit/Mint/Withdraw/Redeem</li>
 *   <li>{@code GET /api/vault/limits/{address}} -- maxDeposit/Mint/Withdraw/Redeem</li>
 *   <li>{@code POST /api/vault/deposit|mint|withdraw|redeem} -- safe variant when a limit is given</li>
 *   <li>{@code POST /api/vault/swap-deposit} -- deposit of another token, swapped into the asset</li>
 *   <li>{@code POST /api/vault/transfer|approve} -- share movements</li>
 *   <li>{@code POST /api/vault/fees/collect}, {@code GET /api/vault/fees/preview}, {@code PUT /api/vault/fees}</li>
 *   <li>{@code POST /api/vault/seed}, {@code PUT /api/vault/max-total-assets|min-liquidity|asset}</li>
 *   <li>{@code POST /api/vault/pause|unpause}</li>
 *   <li>{@code GET /api/vault/events} -- journaled events, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/vault")
public class VaultController {

    private final ShareLedger shareLedger;
    private final FeeAccrualEngine feeAccrualEngine;
    private final VaultAccounting accounting;
    private final VaultService vaultService;
    private final AccountingEventJournal accountingEventJournal;

    public VaultController(
            ShareLedger shareLedger,
            FeeAccrualEngine feeAccrualEngine,
            VaultAccounting accounting,
            VaultService vaultService,
            AccountingEventJournal accountingEventJournal) {
        this.shareLedger = shareLedger;
        this.feeAccrualEngine = feeAccrualEngine;
        this.accounting = accounting;
        this.vaultService = vaultService;
        this.accountingEventJournal = accountingEventJournal;
    }

    // ==============================
    // QUERIES
    // ==============================

    @GetMapping
    public VaultStateResponse getState() {
        return vaultService.state();
    }

    @GetMapping("/accounts/{address}")
    public Map<String, Object> getAccount(@PathVariable String address) {
        Map<String, Object> account = new LinkedHashMap<>();
        account.put("address", address);
        account.put("shares", accounting.state().sharesOf(address));
        account.put("assets", shareLedger.assetsOf(address));
        return account;
    }

    @GetMapping("/preview")
    public Map<String, BigInteger> preview(@RequestParam BigInteger amount) {
        Map<String, BigInteger> previews = new LinkedHashMap<>();
        previews.put("deposit", shareLedger.previewDeposit(amount));
        previews.put("mint", shareLedger.previewMint(amount));
        previews.put("withdraw", shareLedger.previewWithdraw(amount));
        previews.put("redeem", shareLedger.previewRedeem(amount));
        return previews;
    }

    @GetMapping("/limits/{address}")
    public Map<String, BigInteger> limits(@PathVariable String address) {
        Map<String, BigInteger> limits = new LinkedHashMap<>();
        limits.put("maxDeposit", shareLedger.maxDeposit(address));
        limits.put("maxMint", shareLedger.maxMint(address));
        limits.put("maxWithdraw", shareLedger.maxWithdraw(address));
        limits.put("maxRedeem", shareLedger.maxRedeem(address));
        return limits;
    }

    @GetMapping("/events")
    public List<AccountingEventRecord> getEvents(
            @RequestParam(required = false) String type, @RequestParam(required = false) String subject) {
        if (type != null) {
            return accountingEventJournal.byEventType(type);
        }
        if (subject != null) {
            return accountingEventJournal.bySubject(subject);
        }
        return accountingEventJournal.recent();
    }

    // ==============================
    // DEPOSIT / WITHDRAW
    // ==============================

    @PostMapping("/deposit")
    public Map<String, BigInteger> deposit(@RequestBody @Valid VaultOperationRequest request) {
        BigInteger shares = request.getLimit() == null
                ? shareLedger.deposit(request.getCaller(), request.getAmount(), request.getReceiver())
                : shareLedger.safeDeposit(
                        request.getCaller(),
                        request.getAmount(),
                        request.getReceiver(),
                        request.getLimit(),
                        request.deadlineInstant());
        return Map.of("shares", shares);
    }

    @PostMapping("/swap-deposit")
    public Map<String, BigInteger> swapDeposit(@RequestBody @Valid SwapDepositRequest request) {
        BigInteger shares = shareLedger.swapSafeDeposit(
                request.getCaller(),
                request.getToken(),
                request.getAmount(),
                request.getReceiver(),
                request.getMinShares() != null ? request.getMinShares() : BigInteger.ZERO,
                request.getSwapParams() != null ? request.getSwapParams() : "",
                request.deadlineInstant());
        return Map.of("shares", shares);
    }

    @PostMapping("/mint")
    public Map<String, BigInteger> mint(@RequestBody @Valid VaultOperationRequest request) {
        BigInteger assets = request.getLimit() == null
                ? shareLedger.mint(request.getCaller(), request.getAmount(), request.getReceiver())
                : shareLedger.safeMint(
                        request.getCaller(),
                        request.getAmount(),
                        request.getReceiver(),
                        request.getLimit(),
                        request.deadlineInstant());
        return Map.of("assets", assets);
    }

    @PostMapping("/withdraw")
    public Map<String, BigInteger> withdraw(@RequestBody @Valid VaultOperationRequest request) {
        String owner = ownerOf(request);
        BigInteger shares = request.getLimit() == null
                ? shareLedger.withdraw(request.getCaller(), request.getAmount(), request.getReceiver(), owner)
                : shareLedger.safeWithdraw(
                        request.getCaller(),
                        request.getAmount(),
                        request.getReceiver(),
                        owner,
                        request.getLimit(),
                        request.deadlineInstant());
        return Map.of("shares", shares);
    }

    @PostMapping("/redeem")
    public Map<String, BigInteger> redeem(@RequestBody @Valid VaultOperationRequest request) {
        String owner = ownerOf(request);
        BigInteger assets = request.getLimit() == null
                ? shareLedger.redeem(request.getCaller(), request.getAmount(), request.getReceiver(), owner)
                : shareLedger.safeRedeem(
                        request.getCaller(),
                        request.getAmount(),
                        request.getReceiver(),
                        owner,
                        request.getLimit(),
                        request.deadlineInstant());
        return Map.of("assets", assets);
    }

    @PostMapping("/transfer")
    public Map<String, String> transfer(@RequestBody @Valid ShareTransferRequest request) {
        String from = request.getFrom() != null ? request.getFrom() : request.getCaller();
        shareLedger.transfer(request.getCaller(), from, request.getTo(), request.getShares());
        return Map.of("message", "Shares transferred");
    }

    @PostMapping("/approve")
    public Map<String, String> approve(@RequestBody @Valid ShareTransferRequest request) {
        shareLedger.approve(request.getCaller(), request.getTo(), request.getShares());
        return Map.of("message", "Allowance set");
    }

    // ==============================
    // FEES
    // ==============================

    @PostMapping("/fees/collect")
    public FeeCollectionResult collectFees() {
        return feeAccrualEngine.collectFees();
    }

    @GetMapping("/fees/preview")
    public FeeCollectionResult previewFees() {
        return feeAccrualEngine.previewFees();
    }

    @PutMapping("/fees")
    public Fees setFees(@RequestBody @Valid FeesRequest request) {
        Fees fees = Fees.builder()
                .perf(request.getPerf())
                .mgmt(request.getMgmt())
                .entry(request.getEntry())
                .exit(request.getExit())
                .build();
        shareLedger.setFees(fees);
        return fees;
    }

    // ==============================
    // CONFIGURATION
    // ==============================

    /** {@code limit} carries the cap set together with the seed, uncapped when absent; {@code caller} funds it. */
    @PostMapping("/seed")
    public Map<String, BigInteger> seed(@RequestBody @Valid AmountRequest request) {
        BigInteger cap = request.getLimit() != null ? request.getLimit() : AmountMath.MAX_UINT256;
        BigInteger shares = shareLedger.seedLiquidity(request.getCaller(), request.getAmount(), cap);
        return Map.of("shares", shares);
    }

    @PutMapping("/max-total-assets")
    public Map<String, BigInteger> setMaxTotalAssets(@RequestBody @Valid AmountRequest request) {
        shareLedger.setMaxTotalAssets(request.getAmount());
        return Map.of("maxTotalAssets", request.getAmount());
    }

    @PutMapping("/min-liquidity")
    public Map<String, BigInteger> setMinLiquidity(@RequestBody @Valid AmountRequest request) {
        shareLedger.setMinLiquidity(request.getAmount());
        return Map.of("minLiquidity", request.getAmount());
    }

    @PutMapping("/asset")
    public Map<String, String> updateAsset(@RequestBody @Valid UpdateAssetRequest request) {
        shareLedger.updateAsset(request.getAsset(), request.getSwapParams() != null ? request.getSwapParams() : "");
        return Map.of("asset", accounting.state().getAsset());
    }

    @PostMapping("/pause")
    public Map<String, String> pause() {
        shareLedger.pause();
        return Map.of("message", "Vault paused");
    }

    @PostMapping("/unpause")
    public Map<String, String> unpause() {
        shareLedger.unpause();
        return Map.of("message", "Vault unpaused");
    }

    private static String ownerOf(VaultOperationRequest request) {
        return request.getOwner() != null ? request.getOwner() : request.getCaller();
    }
}
