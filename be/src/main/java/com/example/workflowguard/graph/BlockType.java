package com.example.workflowguard.graph;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognized block types. Each constant also carries the kebab-case value used by the editor.
 */
public enum BlockType {

    // Triggers
    PRICE_MONITOR("price-monitor"),
    SCHEDULE("schedule"),
    WEBHOOK("webhook"),
    PROTOCOL_MONITOR("protocol-monitor"),
    YIELD_MONITOR("yield-monitor"),

    // Actions
    HTTP_REQUEST("http-request"),
    EMAIL("email"),
    NOTIFICATION("notification"),
    DISCORD("discord"),
    SMS("sms"),
    DATABASE("database"),
    WALLET("wallet"),
    TRANSACTION("transaction"),
    SWAP_EXECUTOR("swap-executor"),
    PORTFOLIO_BALANCE("portfolio-balance"),

    // Logic
    CONDITION("condition"),
    DELAY("delay"),
    TRANSFORM("transform"),

    // AI and user code
    AI("ai"),
    LLM_PROMPT("llm-prompt"),
    AI_BLOCKCHAIN("ai-blockchain"),
    CUSTOM("custom"),

    UNKNOWN("unknown");

    private final String value;

    BlockType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves either the constant name ({@code HTTP_REQUEST}) or the editor value ({@code http-request}),
     * ignoring case. Empty when the text is null or not a recognized block type.
     */
    public static Optional<BlockType> fromValue(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (BlockType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
