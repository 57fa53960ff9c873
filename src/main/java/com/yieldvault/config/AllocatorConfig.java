package com.yieldvault.config;

import com.yieldvault.allocator.LocalVaultEntryPoint;
import com.yieldvault.ledger.ShareLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers this instance's vault as a strategy entry point the allocator can dispatch to.
 *
 * <p>The entry point address holds the allocator's vault shares. List it under
 * {@code yieldvault.vault.cap-exempt} so dispatches are not bounded by the deposit cap.
 *
 * <p>Properties prefix: {@code yieldvault.allocator.*}
 */
@Configuration
public class AllocatorConfig {

    @Bean
    public LocalVaultEntryPoint localVaultEntryPoint(
            @Value("${yieldvault.allocator.local-vault-address:0x00000000000000000000000000000000000000a1}")
                    String address,
            ShareLedger shareLedger) {
        return new LocalVaultEntryPoint(address, shareLedger);
    }
}
