package com.yieldvault.config;

import com.yieldvault.allocation.AllocationParameters;
import com.yieldvault.domain.enums.SlippageComposition;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import java.math.BigInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides {@link AllocationParameters}.
 *
 * <p>{@code slippage-composition} defaults to DOUBLED: a slot that swaps and stakes is checked
 * once against twice the per-leg tolerance. PER_LEG checks each leg on its own.
 *
 * <p>Properties prefix: {@code yieldvault.allocation.*}
 */
@Configuration
public class AllocationConfig {

    @Bean
    public AllocationParameters allocationParameters(
            @Value("${yieldvault.allocation.max-slippage-bps:100}") int maxSlippageBps,
            @Value("${yieldvault.allocation.dust-threshold:10}") BigInteger dustThreshold,
            @Value("${yieldvault.allocation.slippage-composition:DOUBLED}") SlippageComposition composition,
            @Value("${yieldvault.allocation.paired-inputs:false}") boolean pairedInputs) {
        if (maxSlippageBps < 0 || maxSlippageBps * 2 > 10_000) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION, "max-slippage-bps out of range: " + maxSlippageBps);
        }
        return AllocationParameters.builder()
                .maxSlippageBps(maxSlippageBps)
                .dustThreshold(dustThreshold)
                .slippageComposition(composition)
                .pairedInputs(pairedInputs)
                .build();
    }
}
