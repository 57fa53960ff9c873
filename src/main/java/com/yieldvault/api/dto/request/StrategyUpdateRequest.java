package com.yieldvault.api.dto.request;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update of a strategy record; only non-null fields are applied. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyUpdateRequest {

    private BigInteger maxDeposit;

    private Boolean whitelisted;

    private Boolean panicked;
}
