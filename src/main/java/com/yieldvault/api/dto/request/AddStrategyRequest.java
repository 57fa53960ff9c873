package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddStrategyRequest {

    @NotBlank(message = "name is required")
    private String name;

    /** Address of a registered strategy entry point. */
    @NotBlank(message = "entryPoint is required")
    private String entryPoint;

    @NotNull(message = "maxDeposit is required")
    @PositiveOrZero(message = "maxDeposit must not be negative")
    private BigInteger maxDeposit;
}
