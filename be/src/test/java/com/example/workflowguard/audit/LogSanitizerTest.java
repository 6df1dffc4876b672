package com.example.workflowguard.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LogSanitizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "login with password=hunter2 now|login with password=[REDACTED] now",
            "TOKEN: abc.def.ghi|TOKEN=[REDACTED]",
            "use api-key = \"s3cr3t\" here|use api-key=[REDACTED] here",
            "send an email every hour|send an email every hour"
    })
    @DisplayName("redacts credential assignments")
    void redactsAssignments(String input, String expected) {
        assertEquals(expected, LogSanitizer.sanitize(input));
    }

    @Test
    @DisplayName("redacts long base64 runs")
    void redactsBase64() {
        String blob = "QUJDREVGR0hJSktMTU5PUFFSU1RVVldYWVphYmNkZWZnaGlqa2xtbm9w";

        assertEquals("payload [REDACTED_BASE64] end", LogSanitizer.sanitize("payload " + blob + " end"));
    }

    @Test
    @DisplayName("truncates after redaction")
    void truncates() {
        String text = "hello world ".repeat(60);

        String sanitized = LogSanitizer.sanitize(text, 100);

        assertThat(sanitized).hasSize(100 + LogSanitizer.TRUNCATED_SUFFIX.length())
                .endsWith(LogSanitizer.TRUNCATED_SUFFIX);
    }

    @Test
    @DisplayName("redacts a secret that straddles the truncation point")
    void secretAtBoundary() {
        String sanitized = LogSanitizer.sanitize("password=hunter2 and more words", 12);

        assertThat(sanitized).doesNotContain("hun").endsWith(LogSanitizer.TRUNCATED_SUFFIX);
    }

    @Test
    @DisplayName("passes null through")
    void nullInput() {
        assertNull(LogSanitizer.sanitize(null));
    }
}
