package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Deposit of a token other than the asset, swapped into the asset before shares are minted. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapDepositRequest {

    @NotBlank(message = "caller is required")
    private String caller;

    @NotBlank(message = "token is required")
    private String token;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private BigInteger amount;

    @NotBlank(message = "receiver is required")
    private String receiver;

    private BigInteger minShares;

    private String swapParams;

    private Long deadline;

    public Instant deadlineInstant() {
        return deadline != null ? Instant.ofEpochSecond(deadline) : null;
    }
}
