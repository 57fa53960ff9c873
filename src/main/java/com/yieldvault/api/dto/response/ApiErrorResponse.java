package com.yieldvault.api.dto.response;

import com.yieldvault.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Failure envelope. {@code code} is the vault error name (e.g. {@code MAX_DEPOSIT_REACHED})
 * so off-chain agents can decide whether to re-submit with adjusted parameters.
 */
@Getter
@Builder
public class ApiErrorResponse {

    @Builder.Default
    private final boolean success = false;

    private final String code;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
