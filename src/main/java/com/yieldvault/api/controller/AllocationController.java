package com.yieldvault.api.controller;

import com.yieldvault.allocation.AllocationEngine;
import com.yieldvault.allocation.AllocationPlanner;
import com.yieldvault.allocation.InputRegistry;
import com.yieldvault.api.dto.request.AllocationRequest;
import com.yieldvault.api.dto.request.InputWeightsRequest;
import com.yieldvault.api.dto.request.WorkflowRequest;
import com.yieldvault.domain.model.AllocationResult;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.service.VaultService;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the allocation engine.
 *
 * <p>{@code invest} and {@code liquidate} take explicit per-slot targets; the
 * {@code invest-available}, {@code liquidate-for} and {@code rebalance} workflows compute
 * them from the slot weights first. {@code empty} winds the vault down.
 */
@RestController
@RequestMapping("/api/vault/allocation")
public class AllocationController {

    private final AllocationEngine allocationEngine;
    private final AllocationPlanner allocationPlanner;
    private final InputRegistry inputRegistry;
    private final VaultService vaultService;

    public AllocationController(
            AllocationEngine allocationEngine,
            AllocationPlanner allocationPlanner,
            InputRegistry inputRegistry,
            VaultService vaultService) {
        this.allocationEngine = allocationEngine;
        this.allocationPlanner = allocationPlanner;
        this.inputRegistry = inputRegistry;
        this.vaultService = vaultService;
    }

    @GetMapping("/inputs")
    public List<InputSlot> getInputs() {
        return inputRegistry.activeSlots();
    }

    @PutMapping("/weights")
    public List<InputSlot> setWeights(@RequestBody @Valid InputWeightsRequest request) {
        int[] weights = request.getWeights().stream().mapToInt(Integer::intValue).toArray();
        allocationEngine.setInputWeights(weights);
        return inputRegistry.activeSlots();
    }

    @GetMapping("/invested")
    public List<BigInteger> getInvested() {
        return allocationPlanner.investedPerSlot();
    }

    /** Per-slot targets for an amount: asset units when investing, input units when liquidating. Zero uses the default amount. */
    @GetMapping("/preview")
    public List<BigInteger> preview(@RequestParam BigInteger amount, @RequestParam boolean investing) {
        return vaultService.preview(amount, investing);
    }

    @PostMapping("/invest")
    public AllocationResult invest(@RequestBody @Valid AllocationRequest request) {
        return allocationEngine.invest(request.getTargets(), swapParams(request.getSwapParams()));
    }

    @PostMapping("/liquidate")
    public AllocationResult liquidate(@RequestBody @Valid AllocationRequest request) {
        BigInteger minLiquidity = request.getMinLiquidity() != null ? request.getMinLiquidity() : BigInteger.ZERO;
        return allocationEngine.liquidate(
                request.getTargets(), minLiquidity, request.isPanic(), swapParams(request.getSwapParams()));
    }

    @PostMapping("/invest-available")
    public AllocationResult investAvailable(@RequestBody(required = false) WorkflowRequest request) {
        return vaultService.investAvailable(request != null ? request.getSwapParams() : null);
    }

    @PostMapping("/liquidate-for")
    public AllocationResult liquidateFor(@RequestBody WorkflowRequest request) {
        BigInteger amount = request.getAmount() != null ? request.getAmount() : BigInteger.ZERO;
        return vaultService.liquidateFor(amount, request.isPanic(), request.getSwapParams());
    }

    @PostMapping("/rebalance")
    public AllocationResult rebalance(@RequestBody(required = false) WorkflowRequest request) {
        return vaultService.rebalance(request != null ? request.getSwapParams() : null);
    }

    @PostMapping("/empty")
    public AllocationResult empty(@RequestBody(required = false) WorkflowRequest request) {
        return request != null
                ? vaultService.emptyStrategy(request.isPanic(), request.getSwapParams())
                : vaultService.emptyStrategy(false, null);
    }

    private static List<String> swapParams(List<String> swapParams) {
        return swapParams != null ? swapParams : VaultService.padSwapParams(null);
    }
}
