package com.rewind.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CheckpointStrategyTest {

    @Test
    @DisplayName("fromValue accepts wire names and enum names")
    void fromValue() {
        assertEquals(CheckpointStrategy.PER_PROMPT, CheckpointStrategy.fromValue("per_prompt"));
        assertEquals(CheckpointStrategy.PER_TOOL_USE, CheckpointStrategy.fromValue("PER_TOOL_USE"));
        assertEquals(CheckpointStrategy.SMART, CheckpointStrategy.fromValue("Smart"));
    }

    @Test
    @DisplayName("fromValue rejects unknown and null values")
    void rejectsUnknown() {
        var ex = assertThrows(IllegalArgumentException.class, () -> CheckpointStrategy.fromValue("hourly"));
        assertTrue(ex.getMessage().contains("hourly"));
        assertThrows(IllegalArgumentException.class, () -> CheckpointStrategy.fromValue(null));
    }

    @Test
    @DisplayName("serializes to its wire name")
    void json() throws Exception {
        var mapper = new ObjectMapper();
        assertEquals("\"per_tool_use\"", mapper.writeValueAsString(CheckpointStrategy.PER_TOOL_USE));
        assertEquals(CheckpointStrategy.MANUAL, mapper.readValue("\"manual\"", CheckpointStrategy.class));
    }
}
