package com.yieldvault.api.dto.request;

import java.math.BigInteger;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Planned workflows: {@code amount} is only read by liquidate-for, {@code panic} by liquidate-for and empty. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest {

    private List<String> swapParams;

    private BigInteger amount;

    private boolean panic;
}
