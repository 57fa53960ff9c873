package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAssetRequest {

    @NotBlank(message = "asset is required")
    private String asset;

    /** Swapper parameters for converting idle cash into the new asset. */
    private String swapParams;
}
