package com.agentnet.integrations;

public enum IntegrationStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
}
