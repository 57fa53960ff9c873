package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Share transfer ({@code from} set) or allowance approval ({@code from} empty, caller is owner). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShareTransferRequest {

    @NotBlank(message = "caller is required")
    private String caller;

    private String from;

    @NotBlank(message = "to is required")
    private String to;

    @NotNull(message = "shares is required")
    @PositiveOrZero(message = "shares must not be negative")
    private BigInteger shares;
}
