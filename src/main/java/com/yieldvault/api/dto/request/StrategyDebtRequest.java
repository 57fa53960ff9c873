package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Debt self-report sent by a strategy entry point. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDebtRequest {

    @NotBlank(message = "caller is required")
    private String caller;

    @NotNull(message = "newDebt is required")
    @PositiveOrZero(message = "newDebt must not be negative")
    private BigInteger newDebt;

    private BigInteger reportedAssets;
}
