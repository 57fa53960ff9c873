package com.yieldvault.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.yieldvault.domain.enums.RewardClaimAbi;
import com.yieldvault.integration.PairedPositionAdapter;
import com.yieldvault.integration.ProtocolAdapter;
import lombok.Builder;
import lombok.Value;

/**
 * An occupied input slot. Empty slots are represented by {@code Optional.empty()} in the
 * registry, never by a zero token address.
 */
@Value
@Builder(toBuilder = true)
public class InputSlot {

    int index;
    String token;
    int weight;
    int decimals;

    /** Receipt/LP token of the position, reported by the adapter's input token for single slots. */
    String positionHandle;

    /** Resolved once when the slot is configured. */
    RewardClaimAbi rewardClaimAbi;

    @JsonIgnore
    ProtocolAdapter adapter;

    @JsonIgnore
    PairedPositionAdapter pairedAdapter;

    public boolean isPaired() {
        return pairedAdapter != null;
    }

    /** Even slot of a pair: the leg that stages on invest and triggers joint unstakes. */
    public boolean isPairLead() {
        return isPaired() && index % 2 == 0;
    }
}
