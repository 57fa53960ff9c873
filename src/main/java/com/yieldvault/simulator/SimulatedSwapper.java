package com.yieldvault.simulator;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.domain.model.SwapResult;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.integration.Swapper;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Swapper that fills at the oracle rate minus a fee.
 *
 * <p>Swap params are ignored except for an optional {@code impact=<bps>} entry, which worsens
 * that single fill by the given basis points. It stands in for the price impact a real
 * aggregator route would carry.
 */
public class SimulatedSwapper implements Swapper, Revertible {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSwapper.class);

    private static final String IMPACT_PREFIX = "impact=";

    private final PriceOracle priceOracle;
    private volatile int feeBps;
    private long swapCount;

    public SimulatedSwapper(PriceOracle priceOracle, int feeBps) {
        this.priceOracle = priceOracle;
        this.feeBps = feeBps;
    }

    @Override
    public SwapResult decodeAndSwap(String inputToken, String outputToken, BigInteger amount, String params) {
        if (amount.signum() <= 0) {
            throw new VaultException(ErrorCode.AMOUNT_TOO_LOW, "Swap amount must be positive");
        }
        int totalBps = feeBps + impactBps(params);
        if (totalBps >= AmountMath.BPS) {
            throw new VaultException(ErrorCode.BAD_REQUEST, "Swap cost of " + totalBps + " bps leaves nothing to receive");
        }
        BigInteger quoted = priceOracle.convert(inputToken, amount, outputToken);
        BigInteger received = AmountMath.floor(quoted, totalBps);
        swapCount++;

        log.debug("Simulated swap {} {} -> {} {} (cost {} bps)", amount, inputToken, received, outputToken, totalBps);
        return new SwapResult(amount, received);
    }

    public void setFeeBps(int feeBps) {
        this.feeBps = feeBps;
    }

    public long getSwapCount() {
        return swapCount;
    }

    @Override
    public Runnable checkpoint() {
        long snapshot = swapCount;
        return () -> swapCount = snapshot;
    }

    private static int impactBps(String params) {
        if (params == null || params.isBlank()) {
            return 0;
        }
        for (String part : params.split(";")) {
            String trimmed = part.trim();
            if (trimmed.startsWith(IMPACT_PREFIX)) {
                try {
                    return Integer.parseInt(trimmed.substring(IMPACT_PREFIX.length()));
                } catch (NumberFormatException e) {
                    throw new VaultException(ErrorCode.BAD_REQUEST, "Malformed swap params: " + params, e);
                }
            }
        }
        return 0;
    }
}
