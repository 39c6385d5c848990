package com.lodestar.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("LDST-1700000000000-0001");
        assertEquals("LDST-1700000000000-0001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setPhase replaces the phase and drops a stale stage")
    void setPhase() {
        MdcContext.setStage("LDST-1", "DISCOVERY", "validate_idea");
        MdcContext.setPhase("LDST-1", "SCOPE");
        assertEquals("SCOPE", MDC.get("phase"));
        assertNull(MDC.get("stage"));
    }

    @Test
    @DisplayName("setStage puts runId, phase and stage in MDC; clearStage keeps the run")
    void setStage() {
        MdcContext.setStage("LDST-1", "SCOPE", "model_capabilities");
        assertEquals("LDST-1", MDC.get("runId"));
        assertEquals("SCOPE", MDC.get("phase"));
        assertEquals("model_capabilities", MDC.get("stage"));

        MdcContext.clearStage();
        assertNull(MDC.get("stage"));
        assertEquals("LDST-1", MDC.get("runId"));
    }

    @Test
    @DisplayName("clear removes all lodestar MDC keys")
    void clear() {
        MdcContext.setStage("LDST-1", "SCOPE", "define_scope");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("phase"));
        assertNull(MDC.get("stage"));
    }
}
