package com.yieldvault.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yieldvault.ledger.AmountMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AmountMathTest {

    private static BigInteger bi(long value) {
        return BigInteger.valueOf(value);
    }

    @Nested
    @DisplayName("mulDiv")
    class MulDiv {

        @Test
        @DisplayName("rounds down by default and up on request")
        void roundsInRequestedDirection() {
            assertThat(AmountMath.mulDiv(bi(10), bi(1), bi(3))).isEqualTo(bi(3));
            assertThat(AmountMath.mulDiv(bi(10), bi(1), bi(3), RoundingMode.UP)).isEqualTo(bi(4));
        }

        @Test
        @DisplayName("exact division is not bumped when rounding up")
        void exactDivisionUnchanged() {
            assertThat(AmountMath.mulDiv(bi(12), bi(1), bi(3), RoundingMode.UP)).isEqualTo(bi(4));
        }

        @Test
        @DisplayName("keeps full precision above 2^256")
        void noIntermediateOverflow() {
            BigInteger result = AmountMath.mulDiv(AmountMath.MAX_UINT256, AmountMath.MAX_UINT256, AmountMath.MAX_UINT256);

            assertThat(result).isEqualTo(AmountMath.MAX_UINT256);
        }

        @Test
        @DisplayName("division by zero fails")
        void divisionByZero() {
            assertThatThrownBy(() -> AmountMath.mulDiv(bi(1), bi(1), BigInteger.ZERO))
                    .isInstanceOf(ArithmeticException.class);
        }

        @Test
        @DisplayName("rounding modes other than UP and DOWN are rejected")
        void unsupportedRounding() {
            assertThatThrownBy(() -> AmountMath.mulDiv(bi(1), bi(1), bi(2), RoundingMode.HALF_UP))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Basis points")
    class BasisPoints {

        @Test
        @DisplayName("bps takes a fraction of 10000")
        void bpsFraction() {
            assertThat(AmountMath.bps(bi(1_000_000), 250, RoundingMode.DOWN)).isEqualTo(bi(25_000));
        }

        @Test
        @DisplayName("floor subtracts the tolerance and never goes below zero")
        void floorSubtractsTolerance() {
            assertThat(AmountMath.floor(bi(10_000), 100)).isEqualTo(bi(9_900));
            assertThat(AmountMath.floor(bi(10_000), 200)).isEqualTo(bi(9_800));
            assertThat(AmountMath.floor(bi(10_000), 20_000)).isEqualTo(BigInteger.ZERO);
        }
    }

    @Test
    @DisplayName("subFloor clamps at zero")
    void subFloorClamps() {
        assertThat(AmountMath.subFloor(bi(5), bi(3))).isEqualTo(bi(2));
        assertThat(AmountMath.subFloor(bi(3), bi(5))).isEqualTo(BigInteger.ZERO);
    }

    @Test
    @DisplayName("orZero and isPositive treat null as zero")
    void nullHandling() {
        assertThat(AmountMath.orZero(null)).isEqualTo(BigInteger.ZERO);
        assertThat(AmountMath.isPositive(null)).isFalse();
        assertThat(AmountMath.isPositive(bi(1))).isTrue();
    }
}
