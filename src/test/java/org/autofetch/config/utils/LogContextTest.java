package org.autofetch.config.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class LogContextTest {

    @AfterEach
    void tearDown() {
        LogContext.clear();
    }

    @Test
    void workerRunCarriesLabelJobAndFreshTraceId() {
        LogContext.startRun("fetch 1001 A", "A");
        String first = MDC.get(LogContext.TRACE_ID);

        assertEquals("fetch 1001 A", MDC.get(LogContext.COMPONENT));
        assertEquals("A", MDC.get(LogContext.JOB));
        assertNotNull(first);

        LogContext.startRun("fetch 1002 A", "A");
        assertNotEquals(first, MDC.get(LogContext.TRACE_ID));

        LogContext.clear();
        assertNull(MDC.get(LogContext.COMPONENT));
    }
}
