package com.docmend.core.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Utility for managing Docmend-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    /**
     * Tags the current thread with a fresh request id and returns it.
     */
    public static String startRequest() {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("requestId", requestId);
        return requestId;
    }

    public static void setReview(String reviewId) {
        MDC.put("reviewId", reviewId);
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("reviewId");
    }
}
