package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Parallel lists; unequal lengths are rejected by the allocator. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {

    @NotNull(message = "amounts are required")
    private List<BigInteger> amounts;

    @NotNull(message = "names are required")
    private List<String> names;
}
