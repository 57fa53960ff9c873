package com.yieldvault.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FeeCollectionResult {

    public static final FeeCollectionResult SKIPPED = FeeCollectionResult.builder()
            .collected(false)
            .profit(BigInteger.ZERO)
            .perfFees(BigInteger.ZERO)
            .mgmtFees(BigInteger.ZERO)
            .feeShares(BigInteger.ZERO)
            .transactionFeesPaid(BigInteger.ZERO)
            .build();

    boolean collected;
    BigInteger profit;
    BigInteger perfFees;
    BigInteger mgmtFees;
    BigInteger feeShares;
    BigInteger transactionFeesPaid;
    BigInteger sharePrice;
}
