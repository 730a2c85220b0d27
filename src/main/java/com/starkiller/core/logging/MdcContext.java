package com.starkiller.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Starkiller-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setDay(int day) {
        MDC.put("day", String.valueOf(day));
    }

    public static void setEncounter(int day, String encounterId) {
        MDC.put("day", String.valueOf(day));
        MDC.put("encounterId", encounterId);
    }

    public static void clearEncounter() {
        MDC.remove("encounterId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("day");
        MDC.remove("encounterId");
    }
}
