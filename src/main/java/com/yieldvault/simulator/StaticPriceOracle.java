package com.yieldvault.simulator;

import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PriceOracle;
import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Price oracle backed by fixed prices. Each token has a price in a common quote unit (18
 * decimals) and its own token decimals:
 * {@code out = amount * price_from * 10^dec_to / (price_to * 10^dec_from)}, rounded down.
 */
public class StaticPriceOracle implements PriceOracle {

    private final Map<String, Feed> feeds = new ConcurrentHashMap<>();

    public StaticPriceOracle setPrice(String token, BigInteger price, int decimals) {
        if (price.signum() <= 0) {
            throw new IllegalArgumentException("Price of " + token + " must be positive");
        }
        feeds.put(token.toLowerCase(), new Feed(price, decimals));
        return this;
    }

    public void removeFeed(String token) {
        feeds.remove(token.toLowerCase());
    }

    @Override
    public boolean hasFeed(String token) {
        return token != null && feeds.containsKey(token.toLowerCase());
    }

    @Override
    public BigInteger convert(String fromToken, BigInteger amount, String toToken) {
        Feed from = feed(fromToken);
        Feed to = feed(toToken);
        if (fromToken.equalsIgnoreCase(toToken)) {
            return amount;
        }
        BigInteger numerator = from.price().multiply(BigInteger.TEN.pow(to.decimals()));
        BigInteger denominator = to.price().multiply(BigInteger.TEN.pow(from.decimals()));
        return AmountMath.mulDiv(amount, numerator, denominator, RoundingMode.DOWN);
    }

    private Feed feed(String token) {
        Feed feed = token == null ? null : feeds.get(token.toLowerCase());
        if (feed == null) {
            throw new VaultException(ErrorCode.MISSING_ORACLE, "No price feed for " + token, Map.of("token", String.valueOf(token)));
        }
        return feed;
    }

    private record Feed(BigInteger price, int decimals) {}
}
