package com.docmend.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LlmPropertiesTest {

    @Test
    @DisplayName("defaults keep AI off with conservative limits")
    void defaults() {
        var props = new LlmProperties();
        assertFalse(props.isEnabled());
        assertEquals(30, props.getTimeoutSeconds());
        assertEquals(1000, props.getMaxTokens());
        assertEquals(0.3, props.getTemperature(), 1e-9);
        assertEquals(4, props.getMaxConcurrentCalls());
        assertEquals(5, props.getContextSections());
        assertEquals(4000, props.getMaxOutlineChars());
    }
}
