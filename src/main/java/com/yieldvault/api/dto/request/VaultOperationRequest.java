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

/**
 * Body of deposit, mint, withdraw and redeem calls.
 *
 * <p>{@code amount} is assets for deposit/withdraw and shares for mint/redeem. When
 * {@code limit} is set the safe variant runs: minimum shares (deposit), maximum assets (mint),
 * maximum shares (withdraw) or minimum assets (redeem). {@code deadline} is epoch seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultOperationRequest {

    @NotBlank(message = "caller is required")
    private String caller;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private BigInteger amount;

    @NotBlank(message = "receiver is required")
    private String receiver;

    /** Share owner for withdraw and redeem; defaults to the caller. */
    private String owner;

    private BigInteger limit;

    private Long deadline;

    public Instant deadlineInstant() {
        return deadline != null ? Instant.ofEpochSecond(deadline) : null;
    }
}
