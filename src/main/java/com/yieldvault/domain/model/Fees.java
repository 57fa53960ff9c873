package com.yieldvault.domain.model;

import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Fee schedule in basis points.
 *
 * <ul>
 *   <li><b>perf</b>: share of profit since the last checkpoint</li>
 *   <li><b>mgmt</b>: annualised share of total assets, pro-rated by elapsed time</li>
 *   <li><b>entry</b>: charged on deposits and mints</li>
 *   <li><b>exit</b>: charged on withdrawals and redemptions</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class Fees {

    public static final Fees MAX_FEES = new Fees(5_000, 200, 200, 200);
    public static final Fees NONE = new Fees(0, 0, 0, 0);

    int perf;
    int mgmt;
    int entry;
    int exit;

    /** Rejects negative values and anything above {@link #MAX_FEES}. */
    public void validate() {
        check("perf", perf, MAX_FEES.perf);
        check("mgmt", mgmt, MAX_FEES.mgmt);
        check("entry", entry, MAX_FEES.entry);
        check("exit", exit, MAX_FEES.exit);
    }

    private static void check(String name, int value, int max) {
        if (value < 0) {
            throw new VaultException(ErrorCode.AMOUNT_TOO_LOW, name + " fee cannot be negative: " + value);
        }
        if (value > max) {
            throw new VaultException(
                    ErrorCode.AMOUNT_TOO_HIGH,
                    name + " fee " + value + " bps exceeds the maximum of " + max + " bps",
                    Map.of("fee", name, "value", value, "max", max));
        }
    }
}
