package com.yieldvault.ledger;

import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/** Input-validation failures shared by the vault and allocator entry points. */
public final class VaultChecks {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private VaultChecks() {}

    public static boolean isZeroAddress(String address) {
        return address == null || address.isBlank() || address.equalsIgnoreCase(ZERO_ADDRESS);
    }

    public static void requireAddress(String address, String name) {
        if (isZeroAddress(address)) {
            throw new VaultException(ErrorCode.ADDRESS_IS_ZERO, name + " address is zero");
        }
    }

    public static void requirePositive(BigInteger amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new VaultException(ErrorCode.AMOUNT_TOO_LOW, name + " must be positive");
        }
    }

    public static void requireNonNegative(BigInteger amount, String name) {
        if (amount == null || amount.signum() < 0) {
            throw new VaultException(ErrorCode.AMOUNT_TOO_LOW, name + " cannot be negative");
        }
    }

    /** Fails with TRANSACTION_EXPIRED once {@code deadline} has passed. A null deadline never expires. */
    public static void checkDeadline(Clock clock, Instant deadline) {
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new VaultException(
                    ErrorCode.TRANSACTION_EXPIRED, "Deadline " + deadline + " has passed", Map.of("deadline", deadline));
        }
    }

    public static VaultException amountTooLow(String what, BigInteger actual, BigInteger minimum) {
        return new VaultException(
                ErrorCode.AMOUNT_TOO_LOW,
                what + " " + actual + " below minimum " + minimum,
                Map.of("actual", actual, "minimum", minimum));
    }

    public static VaultException amountTooHigh(String what, BigInteger actual, BigInteger maximum) {
        return new VaultException(
                ErrorCode.AMOUNT_TOO_HIGH,
                what + " " + actual + " above maximum " + maximum,
                Map.of("actual", actual, "maximum", maximum));
    }
}
