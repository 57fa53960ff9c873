package com.yieldvault.allocation;

import com.yieldvault.core.guard.Revertible;
import com.yieldvault.domain.model.InputConfig;
import com.yieldvault.domain.model.InputSlot;
import com.yieldvault.exception.ErrorCode;
import com.yieldvault.exception.VaultException;
import com.yieldvault.integration.PairedPositionAdapter;
import com.yieldvault.integration.ProtocolAdapter;
import com.yieldvault.ledger.AmountMath;
import com.yieldvault.ledger.VaultChecks;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fixed arena of {@value #MAX_INPUTS} input slots. Slot indices are stable: slot {@code i}
 * always lines up with index {@code i} of invest/liquidate target arrays.
 *
 * <p>Weights are basis points of total assets; their sum may not exceed {@link AmountMath#BPS}
 * and the remainder stays in the vault as a cash buffer.
 *
 * <p>In paired mode slots come in (even, odd) pairs backed by the same
 * {@link PairedPositionAdapter}: the even slot holds {@code token0}, the odd slot {@code token1}.
 *
 * <p>Not guarded itself: callers mutate it from inside the vault guard.
 */
@Component
public class InputRegistry implements Revertible {

    private static final Logger log = LoggerFactory.getLogger(InputRegistry.class);

    public static final int MAX_INPUTS = 8;

    private final AllocationParameters allocationParameters;
    private InputSlot[] slots = new InputSlot[MAX_INPUTS];

    public InputRegistry(AllocationParameters allocationParameters) {
        this.allocationParameters = allocationParameters;
    }

    public Optional<InputSlot> slot(int index) {
        if (index < 0 || index >= MAX_INPUTS) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots[index]);
    }

    public List<InputSlot> activeSlots() {
        List<InputSlot> active = new ArrayList<>();
        for (InputSlot slot : slots) {
            if (slot != null) {
                active.add(slot);
            }
        }
        return active;
    }

    public int totalWeight() {
        return Arrays.stream(slots).filter(s -> s != null).mapToInt(InputSlot::getWeight).sum();
    }

    public boolean isPaired() {
        return allocationParameters.isPairedInputs();
    }

    /**
     * Replaces all slots. Input {@code i} of the list goes to slot {@code i}; slots beyond the
     * list become empty. The reward-claim interface of each position is resolved here once.
     */
    public void configure(List<InputConfig> configs) {
        if (configs.size() > MAX_INPUTS) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION,
                    "At most " + MAX_INPUTS + " inputs are supported, got " + configs.size());
        }
        validateWeights(configs.stream().mapToInt(InputConfig::getWeight).toArray());
        if (isPaired() && configs.size() % 2 != 0) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION, "Paired inputs must be configured in even/odd pairs");
        }

        Set<String> tokens = new HashSet<>();
        InputSlot[] next = new InputSlot[MAX_INPUTS];
        for (int i = 0; i < configs.size(); i++) {
            InputConfig config = configs.get(i);
            VaultChecks.requireAddress(config.getToken(), "input " + i + " token");
            if (!tokens.add(config.getToken().toLowerCase())) {
                throw new VaultException(
                        ErrorCode.INVALID_CONFIGURATION, "Token " + config.getToken() + " is configured twice");
            }
            next[i] = isPaired() ? pairedSlot(i, config, configs) : singleSlot(i, config);
        }
        slots = next;

        log.info("Inputs configured: {}", describe());
    }

    /** Replaces the weights of the configured slots; {@code weights[i]} applies to slot {@code i}. */
    public void setWeights(int[] weights) {
        if (weights.length > MAX_INPUTS) {
            throw new VaultException(
                    ErrorCode.INCORRECT_ARRAY_LENGTHS,
                    "Expected at most " + MAX_INPUTS + " weights, got " + weights.length);
        }
        validateWeights(weights);
        for (int i = 0; i < MAX_INPUTS; i++) {
            int weight = i < weights.length ? weights[i] : 0;
            if (slots[i] == null && weight != 0) {
                throw new VaultException(ErrorCode.WRONG_REQUEST, "Slot " + i + " is empty and cannot take a weight");
            }
        }
        for (int i = 0; i < MAX_INPUTS; i++) {
            if (slots[i] != null) {
                slots[i] = slots[i].toBuilder().weight(i < weights.length ? weights[i] : 0).build();
            }
        }
        log.info("Input weights set: {}", describe());
    }

    @Override
    public Runnable checkpoint() {
        InputSlot[] snapshot = slots.clone();
        return () -> slots = snapshot;
    }

    static void validateWeights(int[] weights) {
        int sum = 0;
        for (int weight : weights) {
            if (weight < 0) {
                throw new VaultException(ErrorCode.INVALID_CONFIGURATION, "Weights cannot be negative: " + weight);
            }
            sum += weight;
        }
        if (sum > AmountMath.BPS) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION,
                    "Weights sum to " + sum + " bps, above " + AmountMath.BPS,
                    Map.of("totalWeight", sum));
        }
    }

    private InputSlot singleSlot(int index, InputConfig config) {
        ProtocolAdapter adapter = config.getAdapter();
        if (adapter == null || config.getPairedAdapter() != null) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION, "Input " + index + " needs exactly one single-token adapter");
        }
        if (!adapter.inputToken().equalsIgnoreCase(config.getToken())) {
            throw new VaultException(
                    ErrorCode.WRONG_TOKEN,
                    "Adapter of input " + index + " stakes " + adapter.inputToken() + ", not " + config.getToken());
        }
        return InputSlot.builder()
                .index(index)
                .token(config.getToken())
                .weight(config.getWeight())
                .decimals(config.getDecimals())
                .positionHandle(adapter.positionToken())
                .rewardClaimAbi(adapter.rewardClaimAbi())
                .adapter(adapter)
                .build();
    }

    private InputSlot pairedSlot(int index, InputConfig config, List<InputConfig> configs) {
        PairedPositionAdapter adapter = config.getPairedAdapter();
        if (adapter == null || config.getAdapter() != null) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION, "Input " + index + " needs exactly one paired adapter");
        }
        PairedPositionAdapter partner = configs.get(index ^ 1).getPairedAdapter();
        if (partner != adapter) {
            throw new VaultException(
                    ErrorCode.INVALID_CONFIGURATION,
                    "Inputs " + (index & ~1) + " and " + (index | 1) + " must share one paired position");
        }
        String expectedToken = index % 2 == 0 ? adapter.token0() : adapter.token1();
        if (!expectedToken.equalsIgnoreCase(config.getToken())) {
            throw new VaultException(
                    ErrorCode.WRONG_TOKEN,
                    "Input " + index + " must be " + expectedToken + " for this pair, got " + config.getToken());
        }
        return InputSlot.builder()
                .index(index)
                .token(config.getToken())
                .weight(config.getWeight())
                .decimals(config.getDecimals())
                .positionHandle(adapter.positionToken())
                .rewardClaimAbi(adapter.rewardClaimAbi())
                .pairedAdapter(adapter)
                .build();
    }

    private String describe() {
        StringBuilder sb = new StringBuilder("[");
        for (InputSlot slot : activeSlots()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(slot.getIndex()).append(':').append(slot.getToken()).append('@').append(slot.getWeight());
        }
        return sb.append(']').toString();
    }
}
