package com.yieldvault.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Failure taxonomy of the vault core, grouped the same way the failures are raised:
 * input validation, capacity/eligibility, economic/slippage, and state/authorization.
 *
 * <p>Every code maps to an HTTP status for the REST surface. The core itself never
 * recovers from any of them; the whole operation is aborted and rolled back.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ==================== Generic ====================
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),

    // ==================== Input validation ====================
    AMOUNT_TOO_LOW("AMOUNT_TOO_LOW", 422),
    AMOUNT_TOO_HIGH("AMOUNT_TOO_HIGH", 422),
    ADDRESS_IS_ZERO("ADDRESS_IS_ZERO", 400),
    INCORRECT_ARRAY_LENGTHS("INCORRECT_ARRAY_LENGTHS", 400),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", 400),

    // ==================== Capacity / eligibility ====================
    MAX_DEPOSIT_REACHED("MAX_DEPOSIT_REACHED", 422),
    NOT_WHITELISTED("NOT_WHITELISTED", 403),
    STRATEGY_PANICKED("STRATEGY_PANICKED", 409),
    LIQUIDITY_TOO_LOW("LIQUIDITY_TOO_LOW", 422),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", 422),
    MISSING_ORACLE("MISSING_ORACLE", 424),
    CANT_UPDATE_CRATE("CANT_UPDATE_CRATE", 409),

    // ==================== State / authorization ====================
    UNAUTHORIZED("UNAUTHORIZED", 401),
    TRANSACTION_EXPIRED("TRANSACTION_EXPIRED", 408),
    WRONG_REQUEST("WRONG_REQUEST", 409),
    WRONG_TOKEN("WRONG_TOKEN", 409),
    REENTRANT_CALL("REENTRANT_CALL", 409),
    PAUSED("PAUSED", 423);

    private final String code;
    private final int httpStatus;
}
