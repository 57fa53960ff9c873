package com.yieldvault.api.controller;

import com.yieldvault.allocator.Allocator;
import com.yieldvault.api.dto.request.AddStrategyRequest;
import com.yieldvault.api.dto.request.AmountRequest;
import com.yieldvault.api.dto.request.DispatchRequest;
import com.yieldvault.api.dto.request.StrategyDebtRequest;
import com.yieldvault.api.dto.request.StrategyUpdateRequest;
import com.yieldvault.domain.model.StrategyMapEntry;
import com.yieldvault.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for the cross-chain allocator.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/allocator} -- crate balance and total chain debt</li>
 *   <li>{@code GET /api/allocator/strategies} -- strategy map</li>
 *   <li>{@code POST /api/allocator/crate/fund|withdraw} -- crate movements</li>
 *   <li>{@code POST /api/allocator/strategies} -- register a strategy</li>
 *   <li>{@code PATCH /api/allocator/strategies/{name}} -- max deposit, whitelist, panic flag</li>
 *   <li>{@code DELETE /api/allocator/strategies/{name}} -- retire a strategy without debt</li>
 *   <li>{@code POST /api/allocator/dispatch} -- deposit crate assets into strategies</li>
 *   <li>{@code POST /api/allocator/strategies/{name}/liquidate|panic} -- recall assets</li>
 *   <li>{@code POST /api/allocator/debt} -- debt self-report from a strategy entry point</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/allocator")
public class AllocatorController {

    private final Allocator allocator;

    public AllocatorController(Allocator allocator) {
        this.allocator = allocator;
    }

    @GetMapping
    public Map<String, BigInteger> getSummary() {
        Map<String, BigInteger> summary = new LinkedHashMap<>();
        summary.put("crateBalance", allocator.crateBalance());
        summary.put("totalChainDebt", allocator.totalChainDebt());
        return summary;
    }

    @GetMapping("/strategies")
    public List<StrategyMapEntry> getStrategyMap() {
        return allocator.strategyMap();
    }

    @GetMapping("/strategies/{name}")
    public StrategyMapEntry getStrategy(@PathVariable String name) {
        return entry(name);
    }

    @PostMapping("/crate/fund")
    public Map<String, BigInteger> fundCrate(@RequestBody @Valid AmountRequest request) {
        allocator.fundCrate(request.getAmount());
        return Map.of("crateBalance", allocator.crateBalance());
    }

    @PostMapping("/crate/withdraw")
    public Map<String, BigInteger> withdrawFromCrate(@RequestBody @Valid AmountRequest request) {
        allocator.withdrawFromCrate(request.getAmount(), request.getReceiver());
        return Map.of("crateBalance", allocator.crateBalance());
    }

    @PostMapping("/strategies")
    @ResponseStatus(HttpStatus.CREATED)
    public StrategyMapEntry addStrategy(@RequestBody @Valid AddStrategyRequest request) {
        allocator.addStrategy(request.getName(), request.getEntryPoint(), request.getMaxDeposit());
        return entry(request.getName());
    }

    @PatchMapping("/strategies/{name}")
    public StrategyMapEntry updateStrategy(@PathVariable String name, @RequestBody StrategyUpdateRequest request) {
        if (request.getMaxDeposit() != null) {
            allocator.setMaxDeposit(name, request.getMaxDeposit());
        }
        if (request.getWhitelisted() != null) {
            allocator.setWhitelisted(name, request.getWhitelisted());
        }
        if (request.getPanicked() != null) {
            allocator.setPanicked(name, request.getPanicked());
        }
        return entry(name);
    }

    @DeleteMapping("/strategies/{name}")
    public Map<String, String> retireStrategy(@PathVariable String name) {
        allocator.retireStrategy(name);
        return Map.of("message", "Strategy retired");
    }

    @PostMapping("/dispatch")
    public Map<String, BigInteger> dispatch(@RequestBody @Valid DispatchRequest request) {
        BigInteger total = allocator.dispatchAssets(request.getAmounts(), request.getNames());
        return Map.of("dispatched", total, "crateBalance", allocator.crateBalance());
    }

    /** {@code limit} is the minimum amount the strategy must return. */
    @PostMapping("/strategies/{name}/liquidate")
    public Map<String, BigInteger> liquidateStrategy(
            @PathVariable String name, @RequestBody @Valid AmountRequest request) {
        BigInteger minAmountOut = request.getLimit() != null ? request.getLimit() : BigInteger.ZERO;
        BigInteger recovered = allocator.liquidateStrategy(request.getAmount(), minAmountOut, name);
        return Map.of("recovered", recovered);
    }

    @PostMapping("/strategies/{name}/panic")
    public Map<String, BigInteger> panicLiquidate(@PathVariable String name) {
        return Map.of("recovered", allocator.panicLiquidateStrategy(name));
    }

    @PostMapping("/debt")
    public Map<String, BigInteger> updateDebt(@RequestBody @Valid StrategyDebtRequest request) {
        BigInteger reported = request.getReportedAssets() != null ? request.getReportedAssets() : request.getNewDebt();
        allocator.updateStrategyDebt(request.getCaller(), request.getNewDebt(), reported);
        return Map.of("totalChainDebt", allocator.totalChainDebt());
    }

    private StrategyMapEntry entry(String name) {
        return allocator.strategyMap().stream()
                .filter(e -> e.getStrategyName().equals(name))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Strategy", name));
    }
}
