package com.yieldvault.domain.model;

import com.yieldvault.integration.PairedPositionAdapter;
import com.yieldvault.integration.ProtocolAdapter;
import lombok.Builder;
import lombok.Value;

/**
 * Configuration of one input slot. Exactly one of {@code adapter} and {@code pairedAdapter}
 * is set; paired slots come in even/odd pairs sharing the same adapter.
 */
@Value
@Builder
public class InputConfig {

    String token;
    int weight;
    int decimals;
    ProtocolAdapter adapter;
    PairedPositionAdapter pairedAdapter;
}
