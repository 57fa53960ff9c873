package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Fee schedule in basis points. Upper bounds are enforced by the ledger. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeesRequest {

    @Min(value = 0, message = "perf must not be negative")
    private int perf;

    @Min(value = 0, message = "mgmt must not be negative")
    private int mgmt;

    @Min(value = 0, message = "entry must not be negative")
    private int entry;

    @Min(value = 0, message = "exit must not be negative")
    private int exit;
}
