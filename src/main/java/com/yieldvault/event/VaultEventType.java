package com.yieldvault.event;

public enum VaultEventType {
    DEPOSIT,
    WITHDRAW,
    SHARES_TRANSFERRED,
    SHARE_PRICE_UPDATED,
    FEES_COLLECTED,
    FEES_UPDATED,
    MAX_TOTAL_ASSETS_SET,
    MIN_LIQUIDITY_SET,
    PAUSED,
    UNPAUSED,
    ASSET_UPDATED,
    DEPOSIT_REQUEST,
    REDEEM_REQUEST,
    DEPOSIT_REQUEST_CANCELED,
    REDEEM_REQUEST_CANCELED,
    REQUEST_SETTLED,
    REQUEST_CLAIMED,
    INVEST,
    LIQUIDATE,
    INPUTS_UPDATED,
    SLIPPAGE_REJECTED
}
