package com.yieldvault.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimRequest {

    @NotBlank(message = "operator is required")
    private String operator;

    @NotBlank(message = "receiver is required")
    private String receiver;

    /** Epoch seconds; no deadline when absent. */
    private Long deadline;

    public Instant deadlineInstant() {
        return deadline != null ? Instant.ofEpochSecond(deadline) : null;
    }
}
