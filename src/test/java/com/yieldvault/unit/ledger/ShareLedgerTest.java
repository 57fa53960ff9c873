package com.yieldvault.unit.ledger;

import static com.yieldvault.support.VaultHarness.ALICE;
import static com.yieldvault.support.VaultHarness.ASSET;
import static com.yieldvault.support.VaultHarness.BOB;
import static com.yieldvault.support.VaultHarness.DAI;
import static com.yieldvault.support.VaultHarness.LOCAL_ENTRY_POINT;
import static com.yieldvault.support.VaultHarness.ONE;
import static com.yieldvault.support.VaultHarness.SEEDER;
import static com.yieldvault.support.VaultHarness.VAULT;
import static com.yieldvault.support.VaultHarness.WETH;
import static com.yieldvault.support.VaultHarness.noSwapParams;
import static com.yieldvault.support.VaultHarness.targets;
import static com.yieldvault.support.VaultHarness.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yieldvault.domain.model.Fees;
import com.yieldvault.event.VaultEventType;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.VaultChecks;
import com.yieldvault.support.VaultHarness;
import java.math.BigInteger;
import java.time.Duration;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for ShareLedger: seeding, synchronous deposit/mint/withdraw/redeem with fees and caps,
 * share transfers, administration and asset migration, against a vault seeded with 1000 units.
 */
class ShareLedgerTest {

    private VaultHarness vault;

    @BeforeEach
    void setUp() {
        vault = VaultHarness.standard();
    }

    private static void assertVaultError(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOf(VaultException.class)
                .extracting("errorCode")
                .isEqualTo(expected);
    }

    @Nested
    @DisplayName("Seeding")
    class Seeding {

        @Test
        @DisplayName("mints 1:1, sets the cap and unpauses")
        void seedMintsOneToOne() {
            BigInteger shares = vault.shareLedger.seedLiquidity(SEEDER, units(1000), units(5000));

            assertThat(shares).isEqualTo(units(1000));
            assertThat(vault.state.sharesOf(SEEDER)).isEqualTo(units(1000));
            assertThat(vault.state.isPaused()).isFalse();
            assertThat(vault.state.getMaxTotalAssets()).isEqualTo(units(5000));
            assertThat(vault.accounting.sharePrice()).isEqualTo(ONE);
            assertThat(vault.state.getLastCheckpointAssets()).isEqualTo(units(1000));
            assertThat(vault.vaultEventTypes()).contains(VaultEventType.DEPOSIT, VaultEventType.UNPAUSED);
        }

        @Test
        @DisplayName("a second seed is refused")
        void seedTwiceRefused() {
            vault.seed(1000);

            assertVaultError(() -> vault.seed(10), ErrorCode.WRONG_REQUEST);
        }

        @Test
        @DisplayName("seed below the minimum liquidity is refused")
        void seedBelowMinimum() {
            vault.state.setMinLiquidity(units(100));

            assertVaultError(() -> vault.seed(50), ErrorCode.LIQUIDITY_TOO_LOW);
            assertThat(vault.state.isPaused()).isTrue();
        }

        @Test
        @DisplayName("deposits before seeding fail because the vault starts paused")
        void depositBeforeSeed() {
            assertVaultError(() -> vault.shareLedger.deposit(ALICE, units(10), ALICE), ErrorCode.PAUSED);
        }
    }

    @Nested
    @DisplayName("Deposit and mint")
    class DepositAndMint {

        @BeforeEach
        void seed() {
            vault.seed(1000);
        }

        @Test
        @DisplayName("deposit issues shares at the current price")
        void depositAtPrice() {
            BigInteger shares = vault.shareLedger.deposit(ALICE, units(100), ALICE);

            assertThat(shares).isEqualTo(units(100));
            assertThat(vault.accounting.totalAssets()).isEqualTo(units(1100));
            assertThat(vault.accounting.sharePrice()).isEqualTo(ONE);
        }

        @Test
        @DisplayName("deposit after a gain issues fewer shares, rounded down")
        void depositAfterGain() {
            vault.state.getWallet().credit(ASSET, units(100));

            BigInteger shares = vault.shareLedger.deposit(ALICE, units(110), ALICE);

            assertThat(shares).isEqualTo(units(100));
            assertThat(vault.shareLedger.previewRedeem(shares)).isEqualTo(units(110));
        }

        @Test
        @DisplayName("entry fee is reserved for the fee collector and excluded from total assets")
        void entryFeeReserved() {
            vault.shareLedger.setFees(Fees.builder().entry(100).build());

            BigInteger shares = vault.shareLedger.deposit(ALICE, units(100), ALICE);

            assertThat(shares).isEqualTo(units(99));
            assertThat(vault.state.getClaimableTransactionFees()).isEqualTo(units(1));
            assertThat(vault.accounting.totalAssets()).isEqualTo(units(1099));
            assertThat(vault.accounting.sharePrice()).isEqualTo(ONE);
        }

        @Test
        @DisplayName("mint charges the gross amount including the entry fee")
        void mintChargesGross() {
            vault.shareLedger.setFees(Fees.builder().entry(100).build());

            BigInteger assets = vault.shareLedger.mint(ALICE, units(99), ALICE);

            assertThat(assets).isEqualTo(units(100));
            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(units(99));
            assertThat(vault.shareLedger.previewMint(units(99))).isEqualTo(units(100));
        }

        @Test
        @DisplayName("deposit above the cap fails unless the caller is cap-exempt")
        void capEnforced() {
            vault.shareLedger.setMaxTotalAssets(units(1050));

            assertVaultError(() -> vault.shareLedger.deposit(ALICE, units(100), ALICE), ErrorCode.MAX_DEPOSIT_REACHED);
            assertThat(vault.shareLedger.maxDeposit(ALICE)).isEqualTo(units(50));

            vault.shareLedger.deposit(LOCAL_ENTRY_POINT, units(100), LOCAL_ENTRY_POINT);
            assertThat(vault.state.sharesOf(LOCAL_ENTRY_POINT)).isEqualTo(units(100));
            assertThat(vault.shareLedger.maxDeposit(LOCAL_ENTRY_POINT)).isEqualTo(AmountMath.MAX_UINT256);
        }

        @Test
        @DisplayName("the vault itself and the zero address are not valid receivers")
        void receiverChecks() {
            assertVaultError(() -> vault.shareLedger.deposit(ALICE, units(1), VAULT), ErrorCode.UNAUTHORIZED);
            assertVaultError(
                    () -> vault.shareLedger.deposit(ALICE, units(1), VaultChecks.ZERO_ADDRESS),
                    ErrorCode.ADDRESS_IS_ZERO);
        }

        @Test
        @DisplayName("zero amounts are rejected")
        void zeroAmount() {
            assertVaultError(() -> vault.shareLedger.deposit(ALICE, BigInteger.ZERO, ALICE), ErrorCode.AMOUNT_TOO_LOW);
        }

        @Test
        @DisplayName("safeDeposit enforces the minimum shares and the deadline")
        void safeDepositBounds() {
            assertVaultError(
                    () -> vault.shareLedger.safeDeposit(ALICE, units(100), ALICE, units(101), null),
                    ErrorCode.AMOUNT_TOO_LOW);
            assertVaultError(
                    () -> vault.shareLedger.safeDeposit(
                            ALICE, units(100), ALICE, units(100), vault.clock.instant().minusSeconds(1)),
                    ErrorCode.TRANSACTION_EXPIRED);

            BigInteger shares = vault.shareLedger.safeDeposit(
                    ALICE, units(100), ALICE, units(100), vault.clock.instant().plus(Duration.ofMinutes(5)));
            assertThat(shares).isEqualTo(units(100));
        }

        @Test
        @DisplayName("safeMint enforces the maximum assets")
        void safeMintBound() {
            vault.shareLedger.setFees(Fees.builder().entry(100).build());

            assertVaultError(
                    () -> vault.shareLedger.safeMint(ALICE, units(99), ALICE, units(99), null),
                    ErrorCode.AMOUNT_TOO_HIGH);
        }

        @Test
        @DisplayName("a failure after the ledger moved restores the previous state")
        void failureRollsBack() {
            vault.failOn = VaultHarness.vaultEvent(VaultEventType.DEPOSIT);

            assertThatThrownBy(() -> vault.shareLedger.deposit(ALICE, units(100), ALICE))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.state.getTotalSupply()).isEqualTo(units(1000));
            assertThat(vault.state.cash()).isEqualTo(units(1000));
            assertThat(vault.state.getLastCheckpointAssets()).isEqualTo(units(1000));
        }
    }

    @Nested
    @DisplayName("Swap deposit")
    class SwapDeposit {

        @BeforeEach
        void seed() {
            vault.seed(1000);
        }

        @Test
        @DisplayName("a foreign token is swapped into the asset and deposited")
        void swapsThenDeposits() {
            BigInteger shares = vault.shareLedger.swapSafeDeposit(ALICE, WETH, ONE, ALICE, units(2000), "", null);

            assertThat(shares).isEqualTo(units(2000));
            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(units(2000));
            assertThat(vault.accounting.totalAssets()).isEqualTo(units(3000));
            assertThat(vault.state.getWallet().balanceOf(WETH)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.swapper.getSwapCount()).isEqualTo(1);
            assertThat(vault.vaultEventTypes()).contains(VaultEventType.DEPOSIT);
        }

        @Test
        @DisplayName("a fill below the slippage floor is refused and nothing moves")
        void fillBelowFloor() {
            assertVaultError(
                    () -> vault.shareLedger.swapSafeDeposit(ALICE, WETH, ONE, ALICE, BigInteger.ZERO, "impact=200", null),
                    ErrorCode.AMOUNT_TOO_LOW);

            assertThat(vault.state.getTotalSupply()).isEqualTo(units(1000));
            assertThat(vault.state.cash()).isEqualTo(units(1000));
            assertThat(vault.swapper.getSwapCount()).isZero();
        }

        @Test
        @DisplayName("a fill within tolerance still has to meet the minimum shares")
        void minimumShares() {
            BigInteger shares =
                    vault.shareLedger.swapSafeDeposit(ALICE, WETH, ONE, ALICE, units(1990), "impact=50", null);
            assertThat(shares).isEqualTo(units(1990));

            assertVaultError(
                    () -> vault.shareLedger.swapSafeDeposit(ALICE, WETH, ONE, ALICE, units(1991), "impact=50", null),
                    ErrorCode.AMOUNT_TOO_LOW);
            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(units(1990));
        }

        @Test
        @DisplayName("depositing the asset itself skips the swap")
        void assetSkipsSwap() {
            BigInteger shares = vault.shareLedger.swapSafeDeposit(ALICE, ASSET, units(100), ALICE, units(100), "", null);

            assertThat(shares).isEqualTo(units(100));
            assertThat(vault.swapper.getSwapCount()).isZero();
        }

        @Test
        @DisplayName("the deadline is checked before swapping")
        void deadline() {
            assertVaultError(
                    () -> vault.shareLedger.swapSafeDeposit(
                            ALICE, WETH, ONE, ALICE, BigInteger.ZERO, "", vault.clock.instant().minusSeconds(1)),
                    ErrorCode.TRANSACTION_EXPIRED);
            assertThat(vault.swapper.getSwapCount()).isZero();
        }
    }

    @Test
    @DisplayName("a deposit previewed then redeemed never returns more than was put in")
    void roundTripNeverGains() {
        vault.seed(1000);
        vault.state.getWallet().credit(ASSET, units(37));
        vault.shareLedger.setFees(Fees.builder().entry(35).exit(80).build());

        BigInteger amount = BigInteger.ONE;
        for (int i = 0; i < 200; i++) {
            BigInteger shares = vault.shareLedger.previewDeposit(amount);
            assertThat(vault.shareLedger.previewRedeem(shares))
                    .as("round trip of %s", amount)
                    .isLessThanOrEqualTo(amount);
            amount = amount.multiply(BigInteger.valueOf(7)).divide(BigInteger.valueOf(5)).add(BigInteger.valueOf(i));
        }
    }

    @Nested
    @DisplayName("Withdraw and redeem")
    class WithdrawAndRedeem {

        @BeforeEach
        void seedAndDeposit() {
            vault.seed(1000);
            vault.shareLedger.deposit(ALICE, units(100), ALICE);
        }

        @Test
        @DisplayName("withdraw burns shares for the exact assets requested")
        void withdrawExactAssets() {
            BigInteger shares = vault.shareLedger.withdraw(ALICE, units(40), ALICE, ALICE);

            assertThat(shares).isEqualTo(units(40));
            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(units(60));
            assertThat(vault.state.cash()).isEqualTo(units(1060));
            assertThat(vault.state.getLastCheckpointAssets()).isEqualTo(units(1060));
        }

        @Test
        @DisplayName("exit fee burns extra shares on withdraw and is deducted on redeem")
        void exitFee() {
            vault.shareLedger.setFees(Fees.builder().exit(100).build());

            BigInteger assets = vault.shareLedger.redeem(ALICE, units(50), ALICE, ALICE);
            assertThat(assets).isEqualTo(units(50).subtract(ONE.divide(BigInteger.TWO)));

            BigInteger shares = vault.shareLedger.withdraw(ALICE, units(10), ALICE, ALICE);
            assertThat(shares).isGreaterThan(units(10));
        }

        @Test
        @DisplayName("a third party needs an allowance, which is spent")
        void allowanceSpent() {
            assertVaultError(() -> vault.shareLedger.redeem(BOB, units(10), BOB, ALICE), ErrorCode.UNAUTHORIZED);

            vault.shareLedger.approve(ALICE, BOB, units(30));
            BigInteger assets = vault.shareLedger.redeem(BOB, units(10), BOB, ALICE);

            assertThat(assets).isEqualTo(units(10));
            assertThat(vault.state.allowance(ALICE, BOB)).isEqualTo(units(20));
        }

        @Test
        @DisplayName("redeeming more than owned fails")
        void redeemTooMuch() {
            assertVaultError(() -> vault.shareLedger.redeem(ALICE, units(101), ALICE, ALICE), ErrorCode.AMOUNT_TOO_HIGH);
        }

        @Test
        @DisplayName("withdrawals are limited by available cash, not by invested assets")
        void limitedByAvailable() {
            vault.configureSingleInputs(10_000, 0);
            vault.allocationEngine.invest(targets(1080), noSwapParams());

            assertThat(vault.accounting.available()).isEqualTo(units(20));
            assertThat(vault.shareLedger.maxWithdraw(ALICE)).isEqualTo(units(20));
            assertThat(vault.shareLedger.maxRedeem(ALICE)).isEqualTo(units(20));
            assertVaultError(
                    () -> vault.shareLedger.withdraw(ALICE, units(50), ALICE, ALICE), ErrorCode.INSUFFICIENT_FUNDS);
        }

        @Test
        @DisplayName("limits drop to zero while paused")
        void pausedLimits() {
            vault.shareLedger.pause();

            assertThat(vault.shareLedger.maxDeposit(ALICE)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.shareLedger.maxWithdraw(ALICE)).isEqualTo(BigInteger.ZERO);
            assertVaultError(() -> vault.shareLedger.withdraw(ALICE, units(1), ALICE, ALICE), ErrorCode.PAUSED);

            vault.shareLedger.unpause();
            assertThat(vault.shareLedger.maxWithdraw(ALICE)).isEqualTo(units(100));
        }
    }

    @Nested
    @DisplayName("Transfers")
    class Transfers {

        @BeforeEach
        void seed() {
            vault.seed(1000);
        }

        @Test
        @DisplayName("owner moves shares without an allowance")
        void ownerTransfer() {
            vault.shareLedger.transfer(SEEDER, SEEDER, ALICE, units(250));

            assertThat(vault.state.sharesOf(SEEDER)).isEqualTo(units(750));
            assertThat(vault.state.sharesOf(ALICE)).isEqualTo(units(250));
            assertThat(vault.vaultEventTypes()).contains(VaultEventType.SHARES_TRANSFERRED);
        }

        @Test
        @DisplayName("a negative or missing allowance is rejected")
        void approveRejectsNegative() {
            assertVaultError(
                    () -> vault.shareLedger.approve(ALICE, BOB, BigInteger.valueOf(-1)), ErrorCode.AMOUNT_TOO_LOW);
            assertVaultError(() -> vault.shareLedger.approve(ALICE, BOB, null), ErrorCode.AMOUNT_TOO_LOW);
            assertThat(vault.state.allowance(ALICE, BOB)).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("transfer above the balance fails and changes nothing")
        void transferTooMuch() {
            assertVaultError(
                    () -> vault.shareLedger.transfer(SEEDER, SEEDER, ALICE, units(1001)), ErrorCode.AMOUNT_TOO_HIGH);
            assertThat(vault.state.sharesOf(SEEDER)).isEqualTo(units(1000));
        }
    }

    @Nested
    @DisplayName("Administration")
    class Administration {

        @BeforeEach
        void seed() {
            vault.seed(1000);
        }

        @Test
        @DisplayName("fees above the maximum schedule are rejected")
        void feesCapped() {
            assertVaultError(
                    () -> vault.shareLedger.setFees(Fees.builder().perf(5_001).build()), ErrorCode.AMOUNT_TOO_HIGH);
            assertVaultError(
                    () -> vault.shareLedger.setFees(Fees.builder().exit(-1).build()), ErrorCode.AMOUNT_TOO_LOW);

            vault.shareLedger.setFees(Fees.MAX_FEES);
            assertThat(vault.state.getFees()).isEqualTo(Fees.MAX_FEES);
        }

        @Test
        @DisplayName("updateAsset swaps the whole cash balance into the new asset")
        void updateAssetSwapsCash() {
            vault.shareLedger.updateAsset(DAI, "");

            assertThat(vault.state.getAsset()).isEqualTo(DAI);
            assertThat(vault.state.cash()).isEqualTo(units(1000));
            assertThat(vault.state.getWallet().balanceOf(ASSET)).isEqualTo(BigInteger.ZERO);
            assertThat(vault.vaultEventTypes()).contains(VaultEventType.ASSET_UPDATED);
        }

        @Test
        @DisplayName("updateAsset fails when the swap returns less than the slippage floor")
        void updateAssetSlippage() {
            vault.swapper.setFeeBps(200);

            assertVaultError(() -> vault.shareLedger.updateAsset(DAI, ""), ErrorCode.AMOUNT_TOO_LOW);
            assertThat(vault.state.getAsset()).isEqualTo(ASSET);
            assertThat(vault.state.cash()).isEqualTo(units(1000));
        }

        @Test
        @DisplayName("updateAsset requires a price feed and a different token")
        void updateAssetPreconditions() {
            assertVaultError(() -> vault.shareLedger.updateAsset("GHO", ""), ErrorCode.MISSING_ORACLE);
            assertVaultError(() -> vault.shareLedger.updateAsset(ASSET.toLowerCase(), ""), ErrorCode.WRONG_TOKEN);
        }

        @Test
        @DisplayName("updateAsset is refused while a deposit request is escrowed")
        void updateAssetWithPendingDeposit() {
            vault.requestQueue.requestDeposit(ALICE, ALICE, units(10));

            assertVaultError(() -> vault.shareLedger.updateAsset(DAI, ""), ErrorCode.WRONG_REQUEST);
        }
    }
}
