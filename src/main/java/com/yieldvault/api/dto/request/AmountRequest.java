package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single-amount body used by configuration and crate calls. {@code caller}, {@code receiver}
 * and {@code limit} are only read by the endpoints that need them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must not be negative")
    private BigInteger amount;

    private String caller;

    private String receiver;

    private BigInteger limit;
}
