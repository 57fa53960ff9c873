package com.yieldvault.exception;

import java.util.Map;

/**
 * Hard failure raised by the ledger, request queue, allocation engine or allocator.
 * Aborts the whole operation; callers re-submit with adjusted parameters.
 */
public class VaultException extends BaseException {

    public VaultException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public VaultException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public VaultException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
