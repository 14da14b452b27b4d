package com.agentnet.integrations.consensus;

public record DecisionOption(String optionId, String description, String method) {

    public static DecisionOption of(String optionId) {
        return new DecisionOption(optionId, optionId, optionId);
    }
}
