package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Asynchronous deposit or withdraw (amount in assets) or redeem (amount in shares) request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitRequest {

    @NotBlank(message = "operator is required")
    private String operator;

    @NotBlank(message = "owner is required")
    private String owner;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    private BigInteger amount;
}
