package com.yieldvault.domain.enums;

/**
 * Lifecycle of an asynchronous request. A request that is canceled or claimed is removed
 * from the queue, which is the implicit NONE state.
 */
public enum RequestStatus {
    /** Escrowed, waiting for settlement. Cancelable. */
    PENDING,
    /** Settled: shares minted (deposit) or assets reserved (redeem). Only claimable. */
    CLAIMABLE
}
