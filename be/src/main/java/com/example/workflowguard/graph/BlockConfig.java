package com.example.workflowguard.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over a node's configuration map, keyed by block type.
 * <p>
 * Block types with required fields get their own record; everything else falls back to {@link OpenConfig}.
 * </p>
 */
public sealed interface BlockConfig
        permits BlockConfig.HttpRequestConfig, BlockConfig.WebhookConfig, BlockConfig.NotificationConfig,
        BlockConfig.CustomCodeConfig, BlockConfig.OpenConfig {

    /** Names of required fields that are absent, null or blank. */
    List<String> missingRequiredFields();

    static BlockConfig of(BlockType blockType, Map<String, Object> config) {
        Map<String, Object> values = config == null ? Map.of() : config;
        return switch (blockType) {
            case HTTP_REQUEST -> new HttpRequestConfig(text(values, "url"), text(values, "method"), values.get("headers"));
            case WEBHOOK -> new WebhookConfig(text(values, "url"), text(values, "method"));
            case NOTIFICATION -> new NotificationConfig(text(values, "message"), text(values, "type"));
            case CUSTOM -> new CustomCodeConfig(text(values, "code"));
            default -> new OpenConfig(values);
        };
    }

    /**
     * Minimal configuration that satisfies the required fields of the block type.
     */
    static Map<String, Object> defaultsFor(BlockType blockType) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        switch (blockType) {
            case HTTP_REQUEST -> {
                defaults.put("method", "GET");
                defaults.put("url", "https://example.com");
                defaults.put("headers", Map.of());
            }
            case WEBHOOK -> {
                defaults.put("url", "https://example.com/webhook");
                defaults.put("method", "POST");
            }
            case NOTIFICATION -> {
                defaults.put("message", "Default notification");
                defaults.put("type", "info");
            }
            case CUSTOM -> defaults.put("code", "async function execute(inputs) { return inputs; }");
            default -> {
                // no required fields
            }
        }
        return defaults;
    }

    private static String text(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }

    private static List<String> missing(String[] names, String... values) {
        List<String> result = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            if (values[i] == null) {
                result.add(names[i]);
            }
        }
        return List.copyOf(result);
    }

    record HttpRequestConfig(String url, String method, Object headers) implements BlockConfig {
        @Override
        public List<String> missingRequiredFields() {
            return missing(new String[] {"url", "method"}, url, method);
        }
    }

    record WebhookConfig(String url, String method) implements BlockConfig {
        @Override
        public List<String> missingRequiredFields() {
            return missing(new String[] {"url"}, url);
        }
    }

    record NotificationConfig(String message, String type) implements BlockConfig {
        @Override
        public List<String> missingRequiredFields() {
            return missing(new String[] {"message"}, message);
        }
    }

    record CustomCodeConfig(String code) implements BlockConfig {
        @Override
        public List<String> missingRequiredFields() {
            return missing(new String[] {"code"}, code);
        }
    }

    record OpenConfig(Map<String, Object> values) implements BlockConfig {
        @Override
        public List<String> missingRequiredFields() {
            return List.of();
        }
    }
}
