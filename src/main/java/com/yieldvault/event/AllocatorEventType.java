package com.yieldvault.event;

public enum AllocatorEventType {
    WITHDRAW,
    CHAIN_DEBT_UPDATE,
    STRATEGY_ADDED,
    MAX_DEPOSIT_UPDATED,
    STRAT_POSITION_UPDATED,
    STRATEGY_UPDATE,
    DEPOSIT_IN_STRATEGY,
    LOSSES,
    PANIC_LIQUIDATE,
    PANIC_SET
}
