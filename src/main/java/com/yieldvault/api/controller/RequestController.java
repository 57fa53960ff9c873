package com.yieldvault.api.controller;

import com.yieldvault.api.dto.request.ClaimRequest;
import com.yieldvault.api.dto.request.SubmitRequest;
import com.yieldvault.api.dto.request.WorkflowRequest;
import com.yieldvault.domain.model.PendingRequest;
import com.yieldvault.exception.ResourceNotFoundException;
import com.yieldvault.request.RequestQueue;
import com.yieldvault.service.VaultService;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for asynchronous deposit and redeem requests.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/vault/requests} -- all open requests and the queue totals</li>
 *   <li>{@code GET /api/vault/requests/{operator}} -- one operator's request</li>
 *   <li>{@code POST /api/vault/requests/deposit|redeem} -- submit a request</li>
 *   <li>{@code POST /api/vault/requests/withdraw} -- redeem request sized in assets</li>
 *   <li>{@code DELETE /api/vault/requests/deposit|redeem/{operator}} -- cancel a pending request</li>
 *   <li>{@code POST /api/vault/requests/settle-deposits} -- settle every pending deposit</li>
 *   <li>{@code POST /api/vault/requests/settle-redemptions} -- liquidate if needed, then settle redemptions</li>
 *   <li>{@code POST /api/vault/requests/claim-deposit|claim-redeem} -- claim a settled request</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/vault/requests")
public class RequestController {

    private final RequestQueue requestQueue;
    private final VaultService vaultService;

    public RequestController(RequestQueue requestQueue, VaultService vaultService) {
        this.requestQueue = requestQueue;
        this.vaultService = vaultService;
    }

    @GetMapping
    public Map<String, Object> getRequests() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requests", requestQueue.requests());
        body.put("totalDepositRequest", requestQueue.totalDepositRequest());
        body.put("totalRedemptionRequest", requestQueue.totalRedemptionRequest());
        body.put("totalRedemptionRequestAssets", requestQueue.totalRedemptionRequestAssets());
        body.put("totalClaimableRedemption", requestQueue.totalClaimableRedemption());
        return body;
    }

    @GetMapping("/{operator}")
    public PendingRequest getRequest(@PathVariable String operator) {
        return requestQueue
                .pendingRequest(operator)
                .orElseThrow(() -> new ResourceNotFoundException("Request", operator));
    }

    @PostMapping("/deposit")
    @ResponseStatus(HttpStatus.CREATED)
    public PendingRequest requestDeposit(@RequestBody @Valid SubmitRequest request) {
        return requestQueue.requestDeposit(request.getOperator(), request.getOwner(), request.getAmount());
    }

    @PostMapping("/redeem")
    @ResponseStatus(HttpStatus.CREATED)
    public PendingRequest requestRedeem(@RequestBody @Valid SubmitRequest request) {
        return requestQueue.requestRedeem(request.getOperator(), request.getOwner(), request.getAmount());
    }

    @PostMapping("/withdraw")
    @ResponseStatus(HttpStatus.CREATED)
    public PendingRequest requestWithdraw(@RequestBody @Valid SubmitRequest request) {
        return requestQueue.requestWithdraw(request.getOperator(), request.getOwner(), request.getAmount());
    }

    @DeleteMapping("/deposit/{operator}")
    public Map<String, BigInteger> cancelDeposit(@PathVariable String operator) {
        return Map.of("returnedAssets", requestQueue.cancelDepositRequest(operator));
    }

    @DeleteMapping("/redeem/{operator}")
    public Map<String, BigInteger> cancelRedeem(@PathVariable String operator) {
        return Map.of("returnedShares", requestQueue.cancelRedeemRequest(operator));
    }

    @PostMapping("/settle-deposits")
    public Map<String, Integer> settleDeposits() {
        return Map.of("settled", requestQueue.settleDeposits());
    }

    @PostMapping("/settle-redemptions")
    public Map<String, Integer> settleRedemptions(@RequestBody(required = false) WorkflowRequest request) {
        List<String> swapParams = request != null ? request.getSwapParams() : null;
        return Map.of("settled", vaultService.processRedemptions(swapParams));
    }

    @PostMapping("/claim-deposit")
    public Map<String, BigInteger> claimDeposit(@RequestBody @Valid ClaimRequest request) {
        BigInteger shares =
                requestQueue.claimDeposit(request.getOperator(), request.getReceiver(), request.deadlineInstant());
        return Map.of("shares", shares);
    }

    @PostMapping("/claim-redeem")
    public Map<String, BigInteger> claimRedeem(@RequestBody @Valid ClaimRequest request) {
        BigInteger assets =
                requestQueue.claimRedeem(request.getOperator(), request.getReceiver(), request.deadlineInstant());
        return Map.of("assets", assets);
    }
}
