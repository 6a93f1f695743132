package com.yieldoracle.registry;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A read-only view call: function name, address arguments, and which uint256 word of
 * the result holds the value we want.
 */
@Value
@Builder
public class ContractCall {
    String function;
    @Builder.Default
    List<String> args = List.of();
    @Builder.Default
    int outputs = 1;
    @Builder.Default
    int outputIndex = 0;
}
