package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputWeightsRequest {

    /** Weight per slot in bps, eight entries. */
    @NotNull(message = "weights are required")
    @Size(min = 8, max = 8, message = "weights must hold exactly 8 entries")
    private List<Integer> weights;
}
