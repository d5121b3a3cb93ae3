package com.rewind.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSession puts sessionId and projectId in MDC")
    void setSession() {
        MdcContext.setSession("s1", "proj");
        assertEquals("s1", MDC.get("sessionId"));
        assertEquals("proj", MDC.get("projectId"));
        assertNull(MDC.get("checkpointId"));
    }

    @Test
    @DisplayName("setCheckpoint adds checkpointId")
    void setCheckpoint() {
        MdcContext.setCheckpoint("s1", "proj", "cp-1");
        assertEquals("s1", MDC.get("sessionId"));
        assertEquals("cp-1", MDC.get("checkpointId"));
    }

    @Test
    @DisplayName("clear removes all Rewind keys")
    void clear() {
        MdcContext.setCheckpoint("s1", "proj", "cp-1");
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("checkpointId"));
    }
}
