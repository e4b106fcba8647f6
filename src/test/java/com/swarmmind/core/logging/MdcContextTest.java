package com.swarmmind.core.logging;

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
    @DisplayName("setTick puts tick in MDC")
    void setTick() {
        MdcContext.setTick(42);
        assertEquals("42", MDC.get("tick"));
    }

    @Test
    @DisplayName("setAgent puts agentId, agentName and tick in MDC")
    void setAgent() {
        MdcContext.setAgent("a-1", "Neuron-A", 7);
        assertEquals("a-1", MDC.get("agentId"));
        assertEquals("Neuron-A", MDC.get("agentName"));
        assertEquals("7", MDC.get("tick"));
    }

    @Test
    @DisplayName("clearAgent keeps the tick")
    void clearAgent() {
        MdcContext.setAgent("a-1", "Neuron-A", 7);
        MdcContext.clearAgent();
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("agentName"));
        assertEquals("7", MDC.get("tick"));
    }

    @Test
    @DisplayName("clear removes all swarmmind MDC keys")
    void clear() {
        MdcContext.setAgent("a-1", "Neuron-A", 7);
        MdcContext.clear();
        assertNull(MDC.get("agentId"));
        assertNull(MDC.get("agentName"));
        assertNull(MDC.get("tick"));
    }
}
