package com.toolport.tools;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolContextTest {

    @Test
    void readsSecrets() {
        var ctx = new ToolContext("inv", "token", Map.of("KEY", "value"));
        assertEquals("value", ctx.secret("KEY"));
        assertEquals("token", ctx.authTokenOrEmpty());
    }

    @Test
    void missingSecretFails() {
        var ctx = ToolContext.empty("inv");
        var e = assertThrows(IllegalArgumentException.class, () -> ctx.secret("KEY"));
        assertEquals("Secret KEY not found in context.", e.getMessage());
    }

    @Test
    void missingTokenIsEmpty() {
        assertEquals("", ToolContext.empty("inv").authTokenOrEmpty());
        assertTrue(new ToolContext("inv", null, null).secrets().isEmpty());
    }
}
