package com.codesandbox.engine.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogPreviewTest {

    @Test
    void truncate_shortText_unchanged() {
        assertThat(LogPreview.truncate("print(1)")).isEqualTo("print(1)");
    }

    @Test
    void truncate_longText_cutAtLimitWithMarker() {
        String text = "x".repeat(1500);

        String preview = LogPreview.truncate(text);

        assertThat(preview).startsWith("x".repeat(1000)).endsWith("...(500 more chars)");
    }

    @Test
    void truncate_null_isEmpty() {
        assertThat(LogPreview.truncate(null)).isEmpty();
    }
}
