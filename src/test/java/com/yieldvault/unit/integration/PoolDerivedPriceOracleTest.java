package com.yieldvault.unit.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.yieldvault.integration.PoolDerivedPriceOracle;
import com.yieldvault.simulator.SimulatedPairedAdapter;
import com.yieldvault.simulator.StaticPriceOracle;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PoolDerivedPriceOracleTest {

    private static final BigInteger ONE = BigInteger.TEN.pow(18);

    private StaticPriceOracle fallback;
    private PoolDerivedPriceOracle oracle;

    @BeforeEach
    void setUp() {
        fallback = new StaticPriceOracle().setPrice("USDC", ONE, 18).setPrice("DAI", ONE, 18);
        SimulatedPairedAdapter pool = new SimulatedPairedAdapter(
                "DAI", "WETH", "DAI-WETH-LP", ONE.multiply(BigInteger.valueOf(1_000_000)), ONE.multiply(BigInteger.valueOf(500)));
        oracle = new PoolDerivedPriceOracle(pool, fallback);
    }

    @Test
    @DisplayName("pool tokens are priced from the reserves in both directions")
    void pricesFromReserves() {
        assertThat(oracle.convert("WETH", ONE, "DAI")).isEqualTo(ONE.multiply(BigInteger.valueOf(2000)));
        assertThat(oracle.convert("DAI", ONE.multiply(BigInteger.valueOf(2000)), "WETH")).isEqualTo(ONE);
    }

    @Test
    @DisplayName("a pool token has a feed even when the fallback does not")
    void feedFromPool() {
        assertThat(fallback.hasFeed("WETH")).isFalse();
        assertThat(oracle.hasFeed("WETH")).isTrue();
        assertThat(oracle.hasFeed("WBTC")).isFalse();
    }

    @Test
    @DisplayName("conversions outside the pair go to the fallback")
    void delegatesOtherPairs() {
        fallback.setPrice("USDC", ONE.multiply(BigInteger.TWO), 18);

        assertThat(oracle.convert("USDC", ONE, "DAI")).isEqualTo(ONE.multiply(BigInteger.TWO));
    }
}
